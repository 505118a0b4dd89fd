package com.tradestager.staging;

import com.tradestager.domain.model.OrderRecord;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a strategy-level (approve, reject, cancel) or order-level (submitted, filled)
 * transition. On success {@code orders} holds the records as stored after the transition.
 */
@Getter
@Builder
@ToString
public class TransitionResult {

    private final boolean success;
    private final String strategyId;

    /** Set for order-level transitions. */
    private final String orderId;

    private final StagingErrorType errorType;

    @Builder.Default
    private final List<String> reasons = List.of();

    @Builder.Default
    private final List<OrderRecord> orders = List.of();

    public static TransitionResult applied(String strategyId, List<OrderRecord> orders) {
        return TransitionResult.builder()
                .success(true)
                .strategyId(strategyId)
                .orders(List.copyOf(orders))
                .build();
    }

    public static TransitionResult applied(OrderRecord order) {
        return TransitionResult.builder()
                .success(true)
                .strategyId(order.getStrategyId())
                .orderId(order.getId())
                .orders(List.of(order))
                .build();
    }

    public static TransitionResult failure(StagingErrorType errorType, List<String> reasons) {
        return TransitionResult.builder()
                .success(false)
                .errorType(errorType)
                .reasons(List.copyOf(reasons))
                .build();
    }

    public static TransitionResult failure(StagingErrorType errorType, String reason) {
        return failure(errorType, List.of(reason));
    }
}
