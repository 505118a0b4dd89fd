package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Iron condor: a put credit spread below a call credit spread.
 *
 * <p>Requires exactly 4 legs (2 calls, 2 puts), one buy and one sell per instrument, and every
 * put strike strictly below every call strike. With the wrong call/put mix the side rule is
 * checked across all four legs (2 buys, 2 sells); the per-instrument side rule and the strike
 * order need the 2+2 split and are skipped.
 */
public class IronCondorRule implements ArchetypeRule {

    private static final int LEG_COUNT = 4;

    @Override
    public StrategyArchetype archetype() {
        return StrategyArchetype.IRON_CONDOR;
    }

    @Override
    public Optional<StructuralViolation> checkLegCount(int found) {
        return found == LEG_COUNT ? Optional.empty() : Optional.of(legCountViolation(LEG_COUNT, found));
    }

    @Override
    public List<StructuralViolation> check(List<Leg> legs) {
        Optional<StructuralViolation> legCount = checkLegCount(legs.size());
        if (legCount.isPresent()) {
            return List.of(legCount.get());
        }

        List<StructuralViolation> violations = new ArrayList<>();
        long calls = ArchetypeRule.count(legs, OptionType.CALL);
        long puts = ArchetypeRule.count(legs, OptionType.PUT);
        if (calls != 2 || puts != 2) {
            violations.add(violation(
                    StructuralViolation.INSTRUMENT_MIX,
                    "expected 2 calls and 2 puts, found " + calls + " calls and " + puts + " puts"));
            long buys = ArchetypeRule.count(legs, OrderSide.BUY);
            long sells = ArchetypeRule.count(legs, OrderSide.SELL);
            if (buys != 2 || sells != 2) {
                violations.add(violation(
                        StructuralViolation.SIDE_MIX,
                        "expected 2 buys and 2 sells, found " + buys + " buys and " + sells + " sells"));
            }
            return violations;
        }

        List<Leg> callLegs = legsOf(legs, OptionType.CALL);
        List<Leg> putLegs = legsOf(legs, OptionType.PUT);

        checkOneBuyOneSell(callLegs, "call", violations);
        checkOneBuyOneSell(putLegs, "put", violations);

        BigDecimal highestPut = putLegs.stream()
                .map(Leg::getStrike)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        BigDecimal lowestCall = callLegs.stream()
                .map(Leg::getStrike)
                .min(Comparator.naturalOrder())
                .orElseThrow();
        if (highestPut.compareTo(lowestCall) >= 0) {
            violations.add(violation(
                    StructuralViolation.STRIKE_ORDER,
                    "put strikes must be below call strikes, found highest put " + highestPut.toPlainString()
                            + " and lowest call " + lowestCall.toPlainString()));
        }

        return violations;
    }

    private void checkOneBuyOneSell(List<Leg> group, String label, List<StructuralViolation> violations) {
        long buys = ArchetypeRule.count(group, OrderSide.BUY);
        long sells = ArchetypeRule.count(group, OrderSide.SELL);
        if (buys != 1 || sells != 1) {
            violations.add(violation(
                    StructuralViolation.SIDE_MIX,
                    label + " legs must be one buy and one sell, found " + buys + " buys and " + sells + " sells"));
        }
    }

    private static List<Leg> legsOf(List<Leg> legs, OptionType optionType) {
        return legs.stream().filter(leg -> leg.getOptionType() == optionType).toList();
    }
}
