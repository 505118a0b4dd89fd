package com.tradestager.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link DailyLossTracker}.
 *
 * <p><b>Thread safety:</b> increments use {@link ConcurrentHashMap#merge}, which is atomic per
 * trade date, so concurrent fills never drop an increment and different dates never contend.
 */
@Component
@ConditionalOnProperty(name = "tradestager.ledger.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryDailyLossTracker implements DailyLossTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDailyLossTracker.class);

    private final Map<LocalDate, BigDecimal> lossByDate = new ConcurrentHashMap<>();

    @Override
    public BigDecimal recordTradeResult(LocalDate tradeDate, BigDecimal pnl) {
        if (pnl == null || pnl.signum() >= 0) {
            return getDailyLoss(tradeDate);
        }
        BigDecimal total = lossByDate.merge(tradeDate, pnl.abs(), BigDecimal::add);
        log.debug("Recorded loss {} for {}, daily total: {}", pnl.abs(), tradeDate, total);
        return total;
    }

    @Override
    public BigDecimal getDailyLoss(LocalDate tradeDate) {
        return lossByDate.getOrDefault(tradeDate, BigDecimal.ZERO);
    }
}
