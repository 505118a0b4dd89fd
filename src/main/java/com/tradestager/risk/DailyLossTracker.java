package com.tradestager.risk;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-trade-date realized loss counter read during risk assessment.
 *
 * <p>Counters only grow: recording a loss is an atomic increment, gains are ignored, and the
 * value can never go negative. Reads may be slightly stale; risk checks are advisory gates.
 */
public interface DailyLossTracker {

    /**
     * Records the realized P&L of a closed trade. Negative P&L adds its magnitude to the
     * trade date's loss; zero or positive P&L leaves the counter unchanged.
     *
     * @return the loss total for {@code tradeDate} after recording
     */
    BigDecimal recordTradeResult(LocalDate tradeDate, BigDecimal pnl);

    /** Returns the accumulated loss for {@code tradeDate}, zero if nothing was recorded. */
    BigDecimal getDailyLoss(LocalDate tradeDate);
}
