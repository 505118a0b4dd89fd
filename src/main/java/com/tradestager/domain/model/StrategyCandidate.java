package com.tradestager.domain.model;

import com.tradestager.domain.enums.StrategyArchetype;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * A multi-leg options strategy proposal produced by upstream strategy synthesis.
 *
 * <p>Read-only to the staging pipeline. A null {@code archetype} means the proposal named an
 * archetype this system does not recognize; the structural validator reports it as unsupported.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class StrategyCandidate {

    /** Identifier assigned by the synthesis collaborator. May be null. */
    private final String id;

    /** Underlying symbol (e.g., "SPY"). */
    private final String symbol;

    private final StrategyArchetype archetype;

    /** Legs in the order the proposal listed them. */
    private final List<Leg> legs;

    /** Worst-case loss the proposal claims for the whole position. */
    private final BigDecimal declaredMaxRisk;

    /** Best-case profit, if the proposal supplied one. */
    private final BigDecimal declaredMaxProfit;

    private final Map<String, String> metadata;
}
