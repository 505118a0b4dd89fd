package com.tradestager.strategy.rules;

import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.strategy.StructuralViolation;
import java.util.List;
import java.util.Optional;

/**
 * Custom strategies have no shape constraints. Risk assessment is their only gate.
 * A custom strategy still needs at least one leg, otherwise there is nothing to stage.
 */
public class CustomRule implements ArchetypeRule {

    @Override
    public StrategyArchetype archetype() {
        return StrategyArchetype.CUSTOM;
    }

    @Override
    public Optional<StructuralViolation> checkLegCount(int found) {
        if (found == 0) {
            return Optional.of(violation(StructuralViolation.LEG_COUNT, "expected at least 1 leg, found 0"));
        }
        return Optional.empty();
    }

    @Override
    public List<StructuralViolation> check(List<Leg> legs) {
        return checkLegCount(legs.size()).map(List::of).orElseGet(List::of);
    }
}
