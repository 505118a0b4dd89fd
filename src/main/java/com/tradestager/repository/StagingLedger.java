package com.tradestager.repository;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.StrategyRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keyed store of staged strategies and orders, split into an active and a history partition.
 *
 * <p>Implementations must provide per-key atomicity for {@link #compareAndSetStatus}: of two
 * concurrent calls naming the same order and the same expected status, exactly one applies.
 * There is no global lock; writes to different orders never contend.
 *
 * <p>History is read-only: once an order or strategy has been moved there, every write naming
 * it returns {@link LedgerOutcome#ARCHIVED}.
 *
 * <p>Backend I/O failures surface as
 * {@link com.tradestager.exception.LedgerUnavailableException}.
 */
public interface StagingLedger {

    /** Listing order: creation time, then strategy, then leg position. */
    Comparator<OrderRecord> ORDER_SEQUENCE = Comparator.comparing(
                    OrderRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(OrderRecord::getStrategyId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(OrderRecord::getLegIndex);

    Comparator<StrategyRecord> STRATEGY_SEQUENCE =
            Comparator.comparing(StrategyRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Inserts a strategy and all of its orders into the active partition, all or none.
     * Returns CONFLICT without writing anything if any id already exists.
     */
    LedgerUpdateResult insert(StrategyRecord strategy, List<OrderRecord> orders);

    /** Looks an order up in both partitions, active first. */
    Optional<OrderRecord> findOrder(String orderId);

    Optional<StrategyRecord> findStrategy(String strategyId, LedgerPartition partition);

    default Optional<StrategyRecord> findStrategy(String strategyId) {
        return findStrategy(strategyId, LedgerPartition.ALL);
    }

    /** True if the strategy has been moved to history. */
    default boolean isArchived(String strategyId) {
        return findStrategy(strategyId, LedgerPartition.HISTORY).isPresent();
    }

    /**
     * Atomically replaces the order's status if it currently equals {@code expected}.
     *
     * @return APPLIED with the stored record, CONFLICT with the observed record, NOT_FOUND,
     *     or ARCHIVED
     */
    LedgerUpdateResult compareAndSetStatus(String orderId, OrderStatus expected, StatusUpdate update);

    /** Moves a terminal order from active to history. NOT_TERMINAL if it is still live. */
    LedgerUpdateResult moveToHistory(String orderId);

    /** Moves a strategy record from active to history. Its orders are moved separately. */
    LedgerUpdateResult moveStrategyToHistory(String strategyId);

    List<OrderRecord> listOrders(LedgerFilter filter);

    List<StrategyRecord> listStrategies(LedgerPartition partition);

    /** Order count per partition; cheaper than listing where the backend supports it. */
    default int countOrders(LedgerPartition partition) {
        return listOrders(LedgerFilter.builder().partition(partition).build()).size();
    }
}
