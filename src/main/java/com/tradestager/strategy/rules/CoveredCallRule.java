package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Covered call: a single sold call. The covering shares are checked by the risk assessor. */
public class CoveredCallRule implements ArchetypeRule {

    @Override
    public StrategyArchetype archetype() {
        return StrategyArchetype.COVERED_CALL;
    }

    @Override
    public Optional<StructuralViolation> checkLegCount(int found) {
        return found == 1 ? Optional.empty() : Optional.of(legCountViolation(1, found));
    }

    @Override
    public List<StructuralViolation> check(List<Leg> legs) {
        Optional<StructuralViolation> legCount = checkLegCount(legs.size());
        if (legCount.isPresent()) {
            return List.of(legCount.get());
        }

        Leg leg = legs.get(0);
        List<StructuralViolation> violations = new ArrayList<>();
        if (leg.getOptionType() != OptionType.CALL) {
            violations.add(violation(StructuralViolation.INSTRUMENT_MIX, "leg must be a call, found " + leg.getOptionType()));
        }
        if (leg.getSide() != OrderSide.SELL) {
            violations.add(violation(StructuralViolation.SIDE_MIX, "leg must be sold, found " + leg.getSide()));
        }
        return violations;
    }
}
