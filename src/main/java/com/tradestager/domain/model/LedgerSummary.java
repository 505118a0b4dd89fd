package com.tradestager.domain.model;

import com.tradestager.domain.enums.OrderStatus;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Counts over the staging ledger, for status endpoints. */
@Getter
@Builder
public class LedgerSummary {

    private final int activeOrders;
    private final int activeStrategies;
    private final Map<OrderStatus, Long> activeOrdersByStatus;
    private final int historyOrders;
    private final int historyStrategies;
}
