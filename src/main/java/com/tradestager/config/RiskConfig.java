package com.tradestager.config;

import com.tradestager.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean from application.properties.
 *
 * <p>Limits that are zero or negative are accepted but fail every assessment, so a
 * misconfigured limit blocks staging instead of silently allowing unlimited risk. A warning is
 * logged at startup for each one.
 *
 * <p>Supplemental limits default to unset, which disables them. {@code blackout-symbols} is a
 * comma-separated list matched case-insensitively.
 *
 * <p>Properties prefix: {@code tradestager.risk.*}
 */
@Configuration
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradestager.risk.max-position-size:10000}") BigDecimal maxPositionSize,
            @Value("${tradestager.risk.max-portfolio-exposure:50000}") BigDecimal maxPortfolioExposure,
            @Value("${tradestager.risk.max-loss-per-trade:1000}") BigDecimal maxLossPerTrade,
            @Value("${tradestager.risk.max-loss-per-day:5000}") BigDecimal maxLossPerDay,
            @Value("${tradestager.risk.contract-multiplier:100}") BigDecimal contractMultiplier,
            @Value("${tradestager.risk.max-spread-width:#{null}}") BigDecimal maxSpreadWidth,
            @Value("${tradestager.risk.max-capital-at-risk-per-trade-pct:#{null}}") BigDecimal maxCapitalAtRiskPerTradePct,
            @Value("${tradestager.risk.max-symbol-allocation-pct:#{null}}") BigDecimal maxSymbolAllocationPct,
            @Value("${tradestager.risk.max-total-positions:#{null}}") Integer maxTotalPositions,
            @Value("${tradestager.risk.max-positions-per-symbol:#{null}}") Integer maxPositionsPerSymbol,
            @Value("${tradestager.risk.blackout-symbols:}") List<String> blackoutSymbols,
            @Value("${tradestager.risk.supplemental-checks-enabled:true}") boolean supplementalChecksEnabled,
            @Value("${tradestager.risk.high-risk-score-threshold:75}") double highRiskScoreThreshold,
            @Value("${tradestager.risk.moderate-risk-score-threshold:50}") double moderateRiskScoreThreshold,
            @Value("${tradestager.risk.trade-date-zone:America/New_York}") String tradeDateZone) {
        warnIfNotPositive("max-position-size", maxPositionSize);
        warnIfNotPositive("max-portfolio-exposure", maxPortfolioExposure);
        warnIfNotPositive("max-loss-per-trade", maxLossPerTrade);
        warnIfNotPositive("max-loss-per-day", maxLossPerDay);
        warnIfNotPositive("contract-multiplier", contractMultiplier);
        if (!Double.isFinite(highRiskScoreThreshold) || !Double.isFinite(moderateRiskScoreThreshold)) {
            throw new IllegalArgumentException("Risk score thresholds must be finite numbers");
        }
        if (!supplementalChecksEnabled) {
            log.info("Supplemental risk checks disabled; core limits still apply");
        }

        RiskLimits riskLimits = RiskLimits.builder()
                .maxPositionSize(maxPositionSize)
                .maxPortfolioExposure(maxPortfolioExposure)
                .maxLossPerTrade(maxLossPerTrade)
                .maxLossPerDay(maxLossPerDay)
                .contractMultiplier(contractMultiplier)
                .maxSpreadWidth(maxSpreadWidth)
                .maxCapitalAtRiskPerTradePct(maxCapitalAtRiskPerTradePct)
                .maxSymbolAllocationPct(maxSymbolAllocationPct)
                .maxTotalPositions(maxTotalPositions)
                .maxPositionsPerSymbol(maxPositionsPerSymbol)
                .blackoutSymbols(normalize(blackoutSymbols))
                .supplementalChecksEnabled(supplementalChecksEnabled)
                .highRiskScoreThreshold(highRiskScoreThreshold)
                .moderateRiskScoreThreshold(moderateRiskScoreThreshold)
                .tradeDateZone(ZoneId.of(tradeDateZone))
                .build();
        log.info("Risk limits loaded: {}", riskLimits);
        return riskLimits;
    }

    private static Set<String> normalize(List<String> symbols) {
        if (symbols == null) {
            return Set.of();
        }
        return symbols.stream()
                .map(String::trim)
                .filter(symbol -> !symbol.isEmpty())
                .map(symbol -> symbol.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static void warnIfNotPositive(String property, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            log.warn("tradestager.risk.{} is {}; every assessment will fail this check", property, value);
        }
    }
}
