package com.tradestager.repository.memory;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.StrategyRecord;
import com.tradestager.repository.LedgerFilter;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.repository.LedgerUpdateResult;
import com.tradestager.repository.StagingLedger;
import com.tradestager.repository.StatusUpdate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link StagingLedger} backed by four {@link ConcurrentHashMap}s (active and
 * history, orders and strategies).
 *
 * <p><b>Thread safety:</b> every single-order write runs inside
 * {@link ConcurrentHashMap#compute} or {@link ConcurrentHashMap#computeIfPresent}, which hold the
 * bin lock for that key only. A history move puts the record into history and removes it from
 * active inside the same compute call, so a concurrent compare-and-set either sees the active
 * record or finds it gone and reports ARCHIVED.
 *
 * <p>Inserts claim order ids first and the strategy id last, so a reader that finds a strategy
 * always finds its orders.
 */
@Repository
@ConditionalOnProperty(name = "tradestager.ledger.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryStagingLedger implements StagingLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStagingLedger.class);

    private final Map<String, OrderRecord> activeOrders = new ConcurrentHashMap<>();
    private final Map<String, OrderRecord> historyOrders = new ConcurrentHashMap<>();
    private final Map<String, StrategyRecord> activeStrategies = new ConcurrentHashMap<>();
    private final Map<String, StrategyRecord> historyStrategies = new ConcurrentHashMap<>();

    @Override
    public LedgerUpdateResult insert(StrategyRecord strategy, List<OrderRecord> orders) {
        if (activeStrategies.containsKey(strategy.getId()) || historyStrategies.containsKey(strategy.getId())) {
            log.warn("Insert refused: strategy {} already exists", strategy.getId());
            return LedgerUpdateResult.conflict(null);
        }

        List<OrderRecord> claimed = new ArrayList<>(orders.size());
        for (OrderRecord order : orders) {
            OrderRecord existing = historyOrders.containsKey(order.getId())
                    ? historyOrders.get(order.getId())
                    : activeOrders.putIfAbsent(order.getId(), order);
            if (existing != null) {
                claimed.forEach(c -> activeOrders.remove(c.getId(), c));
                log.warn("Insert refused: order {} already exists", order.getId());
                return LedgerUpdateResult.conflict(existing);
            }
            claimed.add(order);
        }

        if (activeStrategies.putIfAbsent(strategy.getId(), strategy) != null) {
            claimed.forEach(c -> activeOrders.remove(c.getId(), c));
            log.warn("Insert refused: strategy {} was inserted concurrently", strategy.getId());
            return LedgerUpdateResult.conflict(null);
        }
        return LedgerUpdateResult.applied();
    }

    @Override
    public Optional<OrderRecord> findOrder(String orderId) {
        OrderRecord active = activeOrders.get(orderId);
        return active != null ? Optional.of(active) : Optional.ofNullable(historyOrders.get(orderId));
    }

    @Override
    public Optional<StrategyRecord> findStrategy(String strategyId, LedgerPartition partition) {
        return switch (partition) {
            case ACTIVE -> Optional.ofNullable(activeStrategies.get(strategyId));
            case HISTORY -> Optional.ofNullable(historyStrategies.get(strategyId));
            case ALL -> {
                StrategyRecord active = activeStrategies.get(strategyId);
                yield active != null ? Optional.of(active) : Optional.ofNullable(historyStrategies.get(strategyId));
            }
        };
    }

    @Override
    public LedgerUpdateResult compareAndSetStatus(String orderId, OrderStatus expected, StatusUpdate update) {
        AtomicReference<LedgerUpdateResult> result = new AtomicReference<>();

        activeOrders.computeIfPresent(orderId, (id, current) -> {
            if (current.getStatus() != expected || !update.versionMatches(current)) {
                result.set(LedgerUpdateResult.conflict(current));
                return current;
            }
            OrderRecord updated = update.applyTo(current);
            result.set(LedgerUpdateResult.applied(updated));
            return updated;
        });

        if (result.get() != null) {
            return result.get();
        }
        OrderRecord archived = historyOrders.get(orderId);
        return archived != null ? LedgerUpdateResult.archived(archived) : LedgerUpdateResult.notFound();
    }

    @Override
    public LedgerUpdateResult moveToHistory(String orderId) {
        AtomicReference<LedgerUpdateResult> result = new AtomicReference<>();

        activeOrders.computeIfPresent(orderId, (id, current) -> {
            if (!current.getStatus().isTerminal()) {
                result.set(LedgerUpdateResult.notTerminal(current));
                return current;
            }
            historyOrders.put(id, current);
            result.set(LedgerUpdateResult.applied(current));
            return null;
        });

        if (result.get() != null) {
            return result.get();
        }
        OrderRecord archived = historyOrders.get(orderId);
        return archived != null ? LedgerUpdateResult.archived(archived) : LedgerUpdateResult.notFound();
    }

    @Override
    public LedgerUpdateResult moveStrategyToHistory(String strategyId) {
        AtomicReference<LedgerUpdateResult> result = new AtomicReference<>();

        activeStrategies.computeIfPresent(strategyId, (id, current) -> {
            historyStrategies.put(id, current);
            result.set(LedgerUpdateResult.applied());
            return null;
        });

        if (result.get() != null) {
            return result.get();
        }
        return historyStrategies.containsKey(strategyId)
                ? LedgerUpdateResult.archived(null)
                : LedgerUpdateResult.notFound();
    }

    @Override
    public List<OrderRecord> listOrders(LedgerFilter filter) {
        Stream<OrderRecord> source = switch (filter.getPartition()) {
            case ACTIVE -> activeOrders.values().stream();
            case HISTORY -> historyOrders.values().stream();
            case ALL -> Stream.concat(
                    activeOrders.values().stream(),
                    historyOrders.values().stream().filter(o -> !activeOrders.containsKey(o.getId())));
        };
        return source.filter(filter::matches).sorted(ORDER_SEQUENCE).toList();
    }

    @Override
    public List<StrategyRecord> listStrategies(LedgerPartition partition) {
        Stream<StrategyRecord> source = switch (partition) {
            case ACTIVE -> activeStrategies.values().stream();
            case HISTORY -> historyStrategies.values().stream();
            case ALL -> Stream.concat(activeStrategies.values().stream(), historyStrategies.values().stream());
        };
        return source.sorted(STRATEGY_SEQUENCE).toList();
    }

    @Override
    public int countOrders(LedgerPartition partition) {
        return switch (partition) {
            case ACTIVE -> activeOrders.size();
            case HISTORY -> historyOrders.size();
            case ALL -> activeOrders.size() + historyOrders.size();
        };
    }
}
