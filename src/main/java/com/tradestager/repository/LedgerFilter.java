package com.tradestager.repository;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Order listing filter. Null fields match everything. */
@Getter
@Builder
@ToString
public class LedgerFilter {

    @Builder.Default
    private final LedgerPartition partition = LedgerPartition.ACTIVE;

    private final Set<OrderStatus> statuses;
    private final String strategyId;
    private final String symbol;

    public static LedgerFilter active() {
        return LedgerFilter.builder().build();
    }

    public static LedgerFilter byStatus(OrderStatus status) {
        return LedgerFilter.builder().statuses(Set.of(status)).build();
    }

    public static LedgerFilter byStrategy(String strategyId) {
        return LedgerFilter.builder()
                .partition(LedgerPartition.ALL)
                .strategyId(strategyId)
                .build();
    }

    public boolean matches(OrderRecord order) {
        if (statuses != null && !statuses.isEmpty() && !statuses.contains(order.getStatus())) {
            return false;
        }
        if (strategyId != null && !strategyId.equals(order.getStrategyId())) {
            return false;
        }
        return symbol == null || symbol.equalsIgnoreCase(order.getSymbol());
    }
}
