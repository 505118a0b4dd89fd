package com.tradestager.event;

import com.tradestager.domain.enums.StrategyStatus;
import com.tradestager.domain.model.StrategyRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the lifecycle controller after a strategy-level transition has been applied to
 * every constituent order.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>StagingMetricsService (staged, approved and rejected counters)</li>
 * </ul>
 */
public class StrategyEvent extends ApplicationEvent {

    private final StrategyRecord strategy;
    private final StrategyEventType eventType;
    private final StrategyStatus aggregateStatus;
    private final String actor;

    public StrategyEvent(
            Object source,
            StrategyRecord strategy,
            StrategyEventType eventType,
            StrategyStatus aggregateStatus,
            String actor) {
        super(source);
        this.strategy = strategy;
        this.eventType = eventType;
        this.aggregateStatus = aggregateStatus;
        this.actor = actor;
    }

    public StrategyRecord getStrategy() {
        return strategy;
    }

    public StrategyEventType getEventType() {
        return eventType;
    }

    /** Aggregate status derived right after the transition. */
    public StrategyStatus getAggregateStatus() {
        return aggregateStatus;
    }

    public String getActor() {
        return actor;
    }

    @Override
    public String toString() {
        return "StrategyEvent{" + eventType + ", strategy=" + strategy.getId() + ", status=" + aggregateStatus
                + ", actor=" + actor + "}";
    }
}
