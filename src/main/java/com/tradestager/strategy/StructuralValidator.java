package com.tradestager.strategy;

import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.strategy.rules.ArchetypeRule;
import com.tradestager.strategy.rules.CoveredCallRule;
import com.tradestager.strategy.rules.CreditSpreadRule;
import com.tradestager.strategy.rules.CustomRule;
import com.tradestager.strategy.rules.IronCondorRule;
import com.tradestager.strategy.rules.LongStraddleRule;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Checks a candidate's leg composition against the shape its archetype requires.
 *
 * <p>Pure and stateless: the same candidate always yields the same violations, so callers may
 * retry freely. An empty list means the candidate is structurally valid. Each archetype maps to
 * exactly one {@link ArchetypeRule} through an exhaustive switch, so adding an archetype without
 * a rule does not compile.
 *
 * <p>Share ownership for covered calls is not checked here; it needs the portfolio snapshot
 * and belongs to the risk assessor.
 */
@Component
public class StructuralValidator {

    private final ArchetypeRule ironCondorRule = new IronCondorRule();
    private final ArchetypeRule putCreditSpreadRule = CreditSpreadRule.putSpread();
    private final ArchetypeRule callCreditSpreadRule = CreditSpreadRule.callSpread();
    private final ArchetypeRule coveredCallRule = new CoveredCallRule();
    private final ArchetypeRule longStraddleRule = new LongStraddleRule();
    private final ArchetypeRule customRule = new CustomRule();

    /**
     * Validates the candidate's legs against its archetype.
     *
     * @param candidate the proposal to check
     * @return every violated rule, or an empty list when the structure is valid
     */
    public List<StructuralViolation> validate(StrategyCandidate candidate) {
        StrategyArchetype archetype = candidate.getArchetype();
        if (archetype == null) {
            return List.of(StructuralViolation.unsupportedArchetype());
        }

        List<Leg> legs = candidate.getLegs() != null ? candidate.getLegs() : List.of();
        ArchetypeRule rule = ruleFor(archetype);
        List<StructuralViolation> violations = new ArrayList<>(checkLegFields(archetype, legs));
        if (inspectable(legs)) {
            violations.addAll(rule.check(legs));
        } else {
            rule.checkLegCount(legs.size()).ifPresent(violations::add);
        }
        return List.copyOf(violations);
    }

    /**
     * Archetype rules compare strikes, so they need every leg present with a strike. Otherwise
     * only the leg-count rule runs.
     */
    private static boolean inspectable(List<Leg> legs) {
        return legs.stream().allMatch(leg -> leg != null && leg.getStrike() != null);
    }

    /**
     * Leg-level invariants shared by every archetype: side and instrument present, strike and
     * quantity strictly positive. Reported ahead of the archetype rule's own violations.
     */
    private List<StructuralViolation> checkLegFields(StrategyArchetype archetype, List<Leg> legs) {
        List<StructuralViolation> violations = new ArrayList<>();
        for (int i = 0; i < legs.size(); i++) {
            Leg leg = legs.get(i);
            String prefix = archetype.getCode() + ": leg " + i + " ";
            if (leg == null) {
                violations.add(StructuralViolation.of(StructuralViolation.LEG_FIELDS, prefix + "is missing"));
                continue;
            }
            if (leg.getSide() == null || leg.getOptionType() == null) {
                violations.add(StructuralViolation.of(
                        StructuralViolation.LEG_FIELDS, prefix + "must declare a side and an instrument"));
            }
            if (leg.getStrike() == null || leg.getStrike().signum() <= 0) {
                violations.add(StructuralViolation.of(StructuralViolation.LEG_FIELDS, prefix + "strike must be positive"));
            }
            if (leg.getQuantity() <= 0) {
                violations.add(StructuralViolation.of(
                        StructuralViolation.LEG_FIELDS, prefix + "quantity must be positive"));
            }
        }
        return violations;
    }

    ArchetypeRule ruleFor(StrategyArchetype archetype) {
        return switch (archetype) {
            case IRON_CONDOR -> ironCondorRule;
            case PUT_CREDIT_SPREAD -> putCreditSpreadRule;
            case CALL_CREDIT_SPREAD -> callCreditSpreadRule;
            case COVERED_CALL -> coveredCallRule;
            case LONG_STRADDLE -> longStraddleRule;
            case CUSTOM -> customRule;
        };
    }
}
