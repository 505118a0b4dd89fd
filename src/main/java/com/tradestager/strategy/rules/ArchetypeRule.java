package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.util.List;
import java.util.Optional;

/**
 * Structural rule set for one archetype.
 *
 * <p>Implementations must be pure and order-independent: the result depends only on the
 * multiset of legs, never on their position in the list.
 */
public interface ArchetypeRule {

    StrategyArchetype archetype();

    /** Returns every violated rule for the given non-null legs. */
    List<StructuralViolation> check(List<Leg> legs);

    /**
     * Leg-count rule on its own. It reads nothing from the legs, so it still runs when leg
     * fields are missing and {@link #check} cannot.
     */
    Optional<StructuralViolation> checkLegCount(int found);

    default StructuralViolation violation(String rule, String detail) {
        return StructuralViolation.of(rule, archetype().getCode() + ": " + detail);
    }

    default StructuralViolation legCountViolation(int expected, int found) {
        return violation(
                StructuralViolation.LEG_COUNT,
                "expected " + expected + (expected == 1 ? " leg" : " legs") + ", found " + found);
    }

    static long count(List<Leg> legs, OptionType optionType) {
        return legs.stream().filter(leg -> leg.getOptionType() == optionType).count();
    }

    static long count(List<Leg> legs, OrderSide side) {
        return legs.stream().filter(leg -> leg.getSide() == side).count();
    }
}
