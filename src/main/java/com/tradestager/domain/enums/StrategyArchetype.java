package com.tradestager.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-shape options strategies recognized by the structural validator.
 *
 * <p>Each constant carries the lower-case code used by upstream strategy synthesis
 * (e.g. "iron_condor"). CUSTOM accepts any leg composition; risk assessment is its only gate.
 */
public enum StrategyArchetype {
    IRON_CONDOR("iron_condor"),
    PUT_CREDIT_SPREAD("put_credit_spread"),
    CALL_CREDIT_SPREAD("call_credit_spread"),
    COVERED_CALL("covered_call"),
    LONG_STRADDLE("long_straddle"),
    CUSTOM("custom");

    private final String code;

    StrategyArchetype(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves an archetype from its code or constant name, case-insensitively.
     * Returns empty for unknown or blank input.
     */
    public static Optional<StrategyArchetype> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (StrategyArchetype archetype : values()) {
            if (archetype.code.equals(normalized)) {
                return Optional.of(archetype);
            }
        }
        return Optional.empty();
    }
}
