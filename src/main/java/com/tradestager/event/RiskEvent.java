package com.tradestager.event;

import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.risk.RiskAssessment;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a candidate passes structural validation but fails risk assessment. Nothing
 * has been written to the ledger at that point; the event is the only trace of the rejection.
 */
public class RiskEvent extends ApplicationEvent {

    private final StrategyCandidate candidate;
    private final RiskAssessment assessment;

    public RiskEvent(Object source, StrategyCandidate candidate, RiskAssessment assessment) {
        super(source);
        this.candidate = candidate;
        this.assessment = assessment;
    }

    public StrategyCandidate getCandidate() {
        return candidate;
    }

    public RiskAssessment getAssessment() {
        return assessment;
    }

    @Override
    public String toString() {
        return "RiskEvent{" + candidate.getSymbol() + ", violations=" + assessment.getViolations().size() + "}";
    }
}
