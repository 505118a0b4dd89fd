package com.tradestager.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradestager.config.RiskConfig;
import com.tradestager.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the RiskLimits bean factory in RiskConfig. */
class RiskConfigTest {

    private final RiskConfig riskConfig = new RiskConfig();

    @Test
    @DisplayName("Builds RiskLimits from the bound property values")
    void riskLimits_fromProperties() {
        RiskLimits riskLimits = riskConfig.riskLimits(
                new BigDecimal("10000"),
                new BigDecimal("50000"),
                new BigDecimal("1000"),
                new BigDecimal("5000"),
                new BigDecimal("100"),
                new BigDecimal("5"),
                new BigDecimal("2"),
                new BigDecimal("15"),
                20,
                3,
                List.of(" gme", "AMC ", ""),
                true,
                75,
                50,
                "America/New_York");

        assertThat(riskLimits.getMaxPositionSize()).isEqualByComparingTo("10000");
        assertThat(riskLimits.getMaxLossPerDay()).isEqualByComparingTo("5000");
        assertThat(riskLimits.getMaxSpreadWidth()).isEqualByComparingTo("5");
        assertThat(riskLimits.getMaxCapitalAtRiskPerTradePct()).isEqualByComparingTo("2");
        assertThat(riskLimits.getMaxTotalPositions()).isEqualTo(20);
        assertThat(riskLimits.getMaxPositionsPerSymbol()).isEqualTo(3);
        assertThat(riskLimits.getBlackoutSymbols()).containsExactlyInAnyOrder("GME", "AMC");
        assertThat(riskLimits.isSupplementalChecksEnabled()).isTrue();
        assertThat(riskLimits.getTradeDateZone()).isEqualTo(ZoneId.of("America/New_York"));
    }

    @Test
    @DisplayName("Unset supplemental limits stay null and disable their checks")
    void unsetSupplementalLimits_null() {
        RiskLimits riskLimits = riskConfig.riskLimits(
                new BigDecimal("10000"),
                new BigDecimal("50000"),
                new BigDecimal("1000"),
                new BigDecimal("5000"),
                new BigDecimal("100"),
                null,
                null,
                null,
                null,
                null,
                null,
                false,
                75,
                50,
                "UTC");

        assertThat(riskLimits.getMaxSpreadWidth()).isNull();
        assertThat(riskLimits.getMaxCapitalAtRiskPerTradePct()).isNull();
        assertThat(riskLimits.getMaxTotalPositions()).isNull();
        assertThat(riskLimits.getBlackoutSymbols()).isEmpty();
        assertThat(riskLimits.isSupplementalChecksEnabled()).isFalse();
    }

    @Test
    @DisplayName("Non-positive limits are accepted so that assessments fail closed")
    void nonPositiveLimit_accepted() {
        RiskLimits riskLimits = riskConfig.riskLimits(
                BigDecimal.ZERO,
                new BigDecimal("50000"),
                new BigDecimal("-1"),
                new BigDecimal("5000"),
                new BigDecimal("100"),
                null,
                null,
                null,
                null,
                null,
                List.of(),
                true,
                75,
                50,
                "UTC");

        assertThat(riskLimits.getMaxPositionSize()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(riskLimits.getMaxLossPerTrade()).isEqualByComparingTo("-1");
    }

    @Test
    @DisplayName("Non-finite score thresholds are refused at startup")
    void nonFiniteThreshold_refused() {
        assertThatThrownBy(() -> riskConfig.riskLimits(
                        new BigDecimal("10000"),
                        new BigDecimal("50000"),
                        new BigDecimal("1000"),
                        new BigDecimal("5000"),
                        new BigDecimal("100"),
                        null,
                        null,
                        null,
                        null,
                        null,
                        List.of(),
                        true,
                        Double.NaN,
                        50,
                        "UTC"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
    }
}
