package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Long straddle: a bought call and a bought put at the same strike. */
public class LongStraddleRule implements ArchetypeRule {

    private static final int LEG_COUNT = 2;

    @Override
    public StrategyArchetype archetype() {
        return StrategyArchetype.LONG_STRADDLE;
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
        boolean oneOfEach = calls == 1 && puts == 1;
        if (!oneOfEach) {
            violations.add(violation(
                    StructuralViolation.INSTRUMENT_MIX,
                    "expected 1 call and 1 put, found " + calls + " calls and " + puts + " puts"));
        }

        long sells = ArchetypeRule.count(legs, OrderSide.SELL);
        if (sells > 0) {
            violations.add(violation(StructuralViolation.SIDE_MIX, "both legs must be bought, found " + sells + " sells"));
        }

        if (oneOfEach && legs.get(0).getStrike().compareTo(legs.get(1).getStrike()) != 0) {
            Leg call = legs.stream().filter(leg -> leg.getOptionType() == OptionType.CALL).findFirst().orElseThrow();
            Leg put = legs.stream().filter(leg -> leg.getOptionType() == OptionType.PUT).findFirst().orElseThrow();
            violations.add(violation(
                    StructuralViolation.STRIKE_MATCH,
                    "call and put strikes must match, found call " + call.getStrike().toPlainString()
                            + " and put " + put.getStrike().toPlainString()));
        }

        return violations;
    }
}
