package com.tradestager.domain.enums;

import java.util.Collection;

/**
 * Aggregate status of a staged strategy, always derived from its orders and never stored.
 *
 * <ul>
 *   <li>FILLED: every order filled</li>
 *   <li>REJECTED: at least one order rejected and none submitted or filled</li>
 *   <li>CANCELLED: at least one order cancelled, none rejected, none submitted or filled</li>
 *   <li>IN_PROGRESS: anything else</li>
 * </ul>
 */
public enum StrategyStatus {
    IN_PROGRESS,
    FILLED,
    REJECTED,
    CANCELLED;

    public static StrategyStatus derive(Collection<OrderStatus> orderStatuses) {
        if (orderStatuses == null || orderStatuses.isEmpty()) {
            return IN_PROGRESS;
        }
        if (orderStatuses.stream().allMatch(status -> status == OrderStatus.FILLED)) {
            return FILLED;
        }
        boolean reachedBroker = orderStatuses.stream()
                .anyMatch(status -> status == OrderStatus.SUBMITTED
                        || status == OrderStatus.PARTIALLY_FILLED
                        || status == OrderStatus.FILLED);
        if (!reachedBroker && orderStatuses.contains(OrderStatus.REJECTED)) {
            return REJECTED;
        }
        if (!reachedBroker && orderStatuses.contains(OrderStatus.CANCELLED)) {
            return CANCELLED;
        }
        return IN_PROGRESS;
    }
}
