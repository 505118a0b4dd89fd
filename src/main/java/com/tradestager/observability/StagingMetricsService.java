package com.tradestager.observability;

import com.tradestager.event.OrderEvent;
import com.tradestager.event.OrderEventType;
import com.tradestager.event.RiskEvent;
import com.tradestager.event.StrategyEvent;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.repository.StagingLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the staging Micrometer metrics.
 *
 * <ul>
 *   <li><b>staging.strategies.staged</b> (counter): strategies written to the ledger</li>
 *   <li><b>staging.strategies.approved</b> (counter)</li>
 *   <li><b>staging.strategies.rejected</b> (counter): operator rejections of staged strategies</li>
 *   <li><b>staging.strategies.cancelled</b> (counter)</li>
 *   <li><b>staging.orders.filled</b> (counter): orders reaching FILLED</li>
 *   <li><b>staging.risk.rejections</b> (counter): candidates refused by risk assessment</li>
 *   <li><b>staging.orders.active</b> (gauge): orders in the active partition</li>
 * </ul>
 *
 * <p>Counters are incremented from Spring ApplicationEvent listeners. The gauge is polled by
 * Micrometer at scrape time.
 */
@Service
public class StagingMetricsService {

    private static final Logger log = LoggerFactory.getLogger(StagingMetricsService.class);

    private final Counter strategiesStagedCounter;
    private final Counter strategiesApprovedCounter;
    private final Counter strategiesRejectedCounter;
    private final Counter strategiesCancelledCounter;
    private final Counter ordersFilledCounter;
    private final Counter riskRejectionsCounter;

    public StagingMetricsService(MeterRegistry meterRegistry, StagingLedger stagingLedger) {
        this.strategiesStagedCounter = Counter.builder("staging.strategies.staged")
                .description("Strategies that passed validation and risk and were staged")
                .register(meterRegistry);

        this.strategiesApprovedCounter = Counter.builder("staging.strategies.approved")
                .description("Staged strategies approved for submission")
                .register(meterRegistry);

        this.strategiesRejectedCounter = Counter.builder("staging.strategies.rejected")
                .description("Staged strategies rejected by an operator")
                .register(meterRegistry);

        this.strategiesCancelledCounter = Counter.builder("staging.strategies.cancelled")
                .description("Staged or approved strategies cancelled before submission")
                .register(meterRegistry);

        this.ordersFilledCounter = Counter.builder("staging.orders.filled")
                .description("Orders fully filled by the broker")
                .register(meterRegistry);

        this.riskRejectionsCounter = Counter.builder("staging.risk.rejections")
                .description("Candidates refused by risk assessment")
                .register(meterRegistry);

        meterRegistry.gauge(
                "staging.orders.active", stagingLedger, ledger -> ledger.countOrders(LedgerPartition.ACTIVE));
    }

    @EventListener
    @Order(20)
    public void onStrategyEvent(StrategyEvent event) {
        switch (event.getEventType()) {
            case STAGED -> strategiesStagedCounter.increment();
            case APPROVED -> strategiesApprovedCounter.increment();
            case REJECTED -> strategiesRejectedCounter.increment();
            case CANCELLED -> strategiesCancelledCounter.increment();
            case ARCHIVED -> log.debug("Strategy {} archived", event.getStrategy().getId());
        }
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.FILLED) {
            ordersFilledCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        riskRejectionsCounter.increment();
        log.debug(
                "Risk rejection counted for {}: {}",
                event.getCandidate().getSymbol(),
                event.getAssessment().getViolationMessages());
    }
}
