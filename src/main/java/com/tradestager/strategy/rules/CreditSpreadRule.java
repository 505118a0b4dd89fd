package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vertical credit spread: two legs of the same instrument, one sold and one bought.
 *
 * <p>The sold strike must sit closer to the money than the bought strike, which is what makes
 * the spread a credit. For puts that means sold strike above bought strike; for calls, below.
 */
public class CreditSpreadRule implements ArchetypeRule {

    private static final int LEG_COUNT = 2;

    private final StrategyArchetype archetype;
    private final OptionType optionType;

    private CreditSpreadRule(StrategyArchetype archetype, OptionType optionType) {
        this.archetype = archetype;
        this.optionType = optionType;
    }

    public static CreditSpreadRule putSpread() {
        return new CreditSpreadRule(StrategyArchetype.PUT_CREDIT_SPREAD, OptionType.PUT);
    }

    public static CreditSpreadRule callSpread() {
        return new CreditSpreadRule(StrategyArchetype.CALL_CREDIT_SPREAD, OptionType.CALL);
    }

    @Override
    public StrategyArchetype archetype() {
        return archetype;
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

        long mismatched = legs.stream().filter(leg -> leg.getOptionType() != optionType).count();
        if (mismatched > 0) {
            violations.add(violation(
                    StructuralViolation.INSTRUMENT_MIX,
                    "both legs must be " + label() + "s, found " + mismatched + " other"));
        }

        long buys = ArchetypeRule.count(legs, OrderSide.BUY);
        long sells = ArchetypeRule.count(legs, OrderSide.SELL);
        if (buys != 1 || sells != 1) {
            violations.add(violation(
                    StructuralViolation.SIDE_MIX,
                    "expected one buy and one sell, found " + buys + " buys and " + sells + " sells"));
        }

        if (violations.isEmpty()) {
            Leg sold = legs.stream().filter(leg -> leg.getSide() == OrderSide.SELL).findFirst().orElseThrow();
            Leg bought = legs.stream().filter(leg -> leg.getSide() == OrderSide.BUY).findFirst().orElseThrow();
            int comparison = sold.getStrike().compareTo(bought.getStrike());
            boolean credit = optionType == OptionType.PUT ? comparison > 0 : comparison < 0;
            if (!credit) {
                violations.add(violation(
                        StructuralViolation.STRIKE_ORDER,
                        "sold strike " + sold.getStrike().toPlainString() + " must be "
                                + (optionType == OptionType.PUT ? "above" : "below")
                                + " bought strike " + bought.getStrike().toPlainString()));
            }
        }

        return violations;
    }

    private String label() {
        return optionType == OptionType.PUT ? "put" : "call";
    }
}
