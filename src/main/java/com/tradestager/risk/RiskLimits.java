package com.tradestager.risk;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * Risk limits applied by the {@link RiskAssessor}.
 *
 * <p>The five core limits (position size, portfolio exposure, per-trade loss, daily loss,
 * contract multiplier) must be positive. A limit that is null, zero or negative fails its
 * check on every assessment rather than disabling it, so a misconfigured limit blocks trading
 * instead of allowing unlimited risk.
 *
 * <p>The supplemental limits (spread width, capital at risk, symbol allocation, position
 * counts, blackout symbols) are optional: null or empty disables the check. They can also be
 * switched off together with {@code supplementalChecksEnabled}; the core limits cannot.
 *
 * <p>Limits are loaded from application.properties (tradestager.risk.*) on startup.
 */
@Data
@Builder
public class RiskLimits {

    /** Maximum declared risk for a single strategy. */
    private BigDecimal maxPositionSize;

    /** Maximum exposure across existing holdings plus the new strategy. */
    private BigDecimal maxPortfolioExposure;

    /** Maximum loss a single trade may risk. */
    private BigDecimal maxLossPerTrade;

    /** Maximum realized plus potential loss per trade date. */
    private BigDecimal maxLossPerDay;

    /** Shares per option contract (100 for standard equity options). */
    private BigDecimal contractMultiplier;

    /** Maximum strike distance for credit spreads. Null = disabled. */
    private BigDecimal maxSpreadWidth;

    /** Maximum declared risk as a percentage of account equity. Null = disabled. */
    private BigDecimal maxCapitalAtRiskPerTradePct;

    /** Symbol exposure above this percentage of equity emits a warning. Null = disabled. */
    private BigDecimal maxSymbolAllocationPct;

    /** Open positions at or above this count block new strategies. Null = disabled. */
    private Integer maxTotalPositions;

    /** Open positions in the candidate's symbol at or above this count block it. Null = disabled. */
    private Integer maxPositionsPerSymbol;

    /** Symbols that may not be staged, upper case. */
    @Builder.Default
    private Set<String> blackoutSymbols = Set.of();

    /** Switch for the supplemental checks and the cash warning. Core limits always apply. */
    @Builder.Default
    private boolean supplementalChecksEnabled = true;

    /** Scores above this emit the "high" warning. */
    @Builder.Default
    private double highRiskScoreThreshold = 75.0;

    /** Scores above this (and not above the high threshold) emit the "moderate" warning. */
    @Builder.Default
    private double moderateRiskScoreThreshold = 50.0;

    /** Zone in which trade dates roll over for daily loss accounting. */
    @Builder.Default
    private ZoneId tradeDateZone = ZoneId.of("America/New_York");
}
