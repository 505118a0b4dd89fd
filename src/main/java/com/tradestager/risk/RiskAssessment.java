package com.tradestager.risk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of assessing a strategy candidate against the risk limits and a portfolio snapshot.
 *
 * <p>A non-empty violation list always means {@code approved == false}. Warnings never block:
 * an assessment may be approved and still carry a "Moderate risk score" warning.
 *
 * <p>When rejected, all violations are included so the trader sees the complete
 * picture (not just the first failure).
 */
@Getter
@Builder
@Jacksonized
@ToString
public class RiskAssessment {

    private final boolean approved;

    /** Weighted score in [0, 100]. Higher means riskier. */
    private final double riskScore;

    private final List<RiskViolation> violations;
    private final List<String> warnings;

    /** Worst-case loss of the candidate, as declared. */
    private final BigDecimal maxLoss;

    /** Capital at risk in this candidate alone. */
    private final BigDecimal positionExposure;

    /** Existing holdings' exposure plus this candidate's. */
    private final BigDecimal portfolioExposure;

    @JsonIgnore
    public boolean isRejected() {
        return !approved;
    }

    /** Violation messages, in detection order, for display and error responses. */
    @JsonIgnore
    public List<String> getViolationMessages() {
        return violations.stream().map(RiskViolation::getMessage).toList();
    }
}
