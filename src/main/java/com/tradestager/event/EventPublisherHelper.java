package com.tradestager.event;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.enums.StrategyStatus;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.domain.model.StrategyRecord;
import com.tradestager.risk.RiskAssessment;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the staging events.
 *
 * <p>Events are published only after the ledger has confirmed the write they describe.
 * Delivery is synchronous ({@code @EventListener}) unless a listener opts into async.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Strategy ----

    public void publishStrategyEvent(
            Object source,
            StrategyRecord strategy,
            StrategyEventType eventType,
            StrategyStatus aggregateStatus,
            String actor) {
        applicationEventPublisher.publishEvent(new StrategyEvent(source, strategy, eventType, aggregateStatus, actor));
    }

    // ---- Order ----

    public void publishOrderSubmitted(Object source, OrderRecord order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.SUBMITTED, previousStatus));
    }

    public void publishOrderFill(Object source, OrderRecord order, OrderStatus previousStatus) {
        OrderEventType eventType = order.getStatus() == OrderStatus.FILLED
                ? OrderEventType.FILLED
                : OrderEventType.PARTIALLY_FILLED;
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousStatus));
    }

    // ---- Risk ----

    public void publishRiskRejection(Object source, StrategyCandidate candidate, RiskAssessment assessment) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, candidate, assessment));
    }
}
