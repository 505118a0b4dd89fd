package com.tradestager.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradestager.risk.InMemoryDailyLossTracker;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for InMemoryDailyLossTracker: loss accumulation, ignored gains and concurrent increments. */
class InMemoryDailyLossTrackerTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2026, 3, 16);

    private InMemoryDailyLossTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryDailyLossTracker();
    }

    @Test
    @DisplayName("Nothing recorded reads as zero")
    void noLosses_zero() {
        assertThat(tracker.getDailyLoss(TRADE_DATE)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Negative P&L accumulates as a positive loss")
    void losses_accumulate() {
        tracker.recordTradeResult(TRADE_DATE, new BigDecimal("-120.50"));
        BigDecimal total = tracker.recordTradeResult(TRADE_DATE, new BigDecimal("-79.50"));

        assertThat(total).isEqualByComparingTo("200");
        assertThat(tracker.getDailyLoss(TRADE_DATE)).isEqualByComparingTo("200");
    }

    @Test
    @DisplayName("Gains never reduce the counter")
    void gains_ignored() {
        tracker.recordTradeResult(TRADE_DATE, new BigDecimal("-300"));
        BigDecimal total = tracker.recordTradeResult(TRADE_DATE, new BigDecimal("500"));

        assertThat(total).isEqualByComparingTo("300");
    }

    @Test
    @DisplayName("Trade dates are tracked independently")
    void separateDates_independent() {
        tracker.recordTradeResult(TRADE_DATE, new BigDecimal("-300"));

        assertThat(tracker.getDailyLoss(TRADE_DATE.plusDays(1))).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Concurrent increments are never dropped")
    void concurrentIncrements_allCounted() throws InterruptedException {
        int threadCount = 8;
        int operationsPerThread = 250;

        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                for (int j = 0; j < operationsPerThread; j++) {
                    tracker.recordTradeResult(TRADE_DATE, new BigDecimal("-1.25"));
                }
                latch.countDown();
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();

        assertThat(tracker.getDailyLoss(TRADE_DATE)).isEqualByComparingTo("2500");
    }
}
