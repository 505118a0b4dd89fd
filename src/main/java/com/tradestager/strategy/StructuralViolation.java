package com.tradestager.strategy;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A single broken structural rule for a strategy candidate.
 *
 * <p>{@code rule} is machine-readable (LEG_COUNT, LEG_FIELDS, INSTRUMENT_MIX, SIDE_MIX,
 * STRIKE_ORDER, STRIKE_MATCH, UNSUPPORTED_ARCHETYPE). {@code message} names the archetype, the rule and the
 * offending values, e.g. "iron_condor: expected 4 legs, found 3".
 */
@Getter
@Builder
@EqualsAndHashCode
public class StructuralViolation {

    public static final String UNSUPPORTED_ARCHETYPE = "UNSUPPORTED_ARCHETYPE";
    public static final String LEG_COUNT = "LEG_COUNT";
    public static final String LEG_FIELDS = "LEG_FIELDS";
    public static final String INSTRUMENT_MIX = "INSTRUMENT_MIX";
    public static final String SIDE_MIX = "SIDE_MIX";
    public static final String STRIKE_ORDER = "STRIKE_ORDER";
    public static final String STRIKE_MATCH = "STRIKE_MATCH";

    private final String rule;
    private final String message;

    public static StructuralViolation of(String rule, String message) {
        return StructuralViolation.builder().rule(rule).message(message).build();
    }

    public static StructuralViolation unsupportedArchetype() {
        return of(UNSUPPORTED_ARCHETYPE, "unsupported archetype");
    }

    @Override
    public String toString() {
        return message;
    }
}
