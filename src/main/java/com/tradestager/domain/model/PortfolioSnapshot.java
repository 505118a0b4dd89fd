package com.tradestager.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time view of the account, supplied by the portfolio collaborator per assessment.
 *
 * <p>Never cached and never mutated by the staging pipeline.
 */
@Getter
@Builder
@Jacksonized
@ToString
public class PortfolioSnapshot {

    private final BigDecimal equity;
    private final BigDecimal cash;
    private final List<PortfolioPosition> positions;

    /** Realized loss per trade date as reported by the portfolio service (positive amounts). */
    private final Map<LocalDate, BigDecimal> dailyRealizedLoss;

    /** Returns the realized loss reported for {@code tradeDate}, or zero when none was reported. */
    public BigDecimal dailyRealizedLoss(LocalDate tradeDate) {
        if (dailyRealizedLoss == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal loss = dailyRealizedLoss.get(tradeDate);
        return loss != null ? loss : BigDecimal.ZERO;
    }

    /** No holdings and no reported losses. Cash is unknown, so no margin warning is raised. */
    public static PortfolioSnapshot empty() {
        return PortfolioSnapshot.builder()
                .positions(List.of())
                .dailyRealizedLoss(Map.of())
                .build();
    }
}
