package com.tradestager.domain.model;

import com.tradestager.domain.enums.StrategyStatus;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Read-only projection of a strategy with its orders and derived aggregate status. */
@Getter
@Builder
public class StrategySnapshot {

    private final StrategyRecord strategy;
    private final List<OrderRecord> orders;
    private final StrategyStatus aggregateStatus;

    /** True once the strategy and its orders live in the history partition. */
    private final boolean archived;

    public static StrategySnapshot of(StrategyRecord strategy, List<OrderRecord> orders, boolean archived) {
        return StrategySnapshot.builder()
                .strategy(strategy)
                .orders(List.copyOf(orders))
                .aggregateStatus(StrategyStatus.derive(
                        orders.stream().map(OrderRecord::getStatus).toList()))
                .archived(archived)
                .build();
    }
}
