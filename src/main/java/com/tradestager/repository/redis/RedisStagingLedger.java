package com.tradestager.repository.redis;

import com.tradestager.config.RedisConfig;
import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.StrategyRecord;
import com.tradestager.exception.LedgerUnavailableException;
import com.tradestager.mapper.JsonHelper;
import com.tradestager.repository.LedgerFilter;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.repository.LedgerUpdateResult;
import com.tradestager.repository.StagingLedger;
import com.tradestager.repository.StatusUpdate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed {@link StagingLedger}, for deployments where several processes stage against
 * the same ledger.
 *
 * <p>Records are stored as JSON strings (see {@link JsonHelper}) under the keys documented in
 * {@link RedisConfig}. Id sets per partition allow listing without a key scan.
 *
 * <p>Every write is an optimistic transaction: WATCH the record keys, read and check, then
 * MULTI/EXEC. If another client touched a watched key in between, EXEC is discarded and the
 * write is retried from the read, so a compare-and-set only applies against the status it
 * actually observed. Reads are plain GETs.
 *
 * <p>Any {@link DataAccessException} is rethrown as {@link LedgerUnavailableException}.
 */
@Repository
@ConditionalOnProperty(name = RedisConfig.LEDGER_BACKEND_PROPERTY, havingValue = "redis")
public class RedisStagingLedger implements StagingLedger {

    private static final Logger log = LoggerFactory.getLogger(RedisStagingLedger.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisStagingLedger(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    // ==== Writes ====

    @Override
    public LedgerUpdateResult insert(StrategyRecord strategy, List<OrderRecord> orders) {
        List<String> watched = new ArrayList<>();
        watched.add(RedisConfig.KEY_PREFIX_STRATEGY + strategy.getId());
        watched.add(RedisConfig.KEY_PREFIX_HISTORY_STRATEGY + strategy.getId());
        for (OrderRecord order : orders) {
            watched.add(RedisConfig.KEY_PREFIX_ORDER + order.getId());
            watched.add(RedisConfig.KEY_PREFIX_HISTORY_ORDER + order.getId());
        }

        return transact("insert strategy " + strategy.getId(), ops -> {
            ops.watch(watched);
            Long existing = ops.countExistingKeys(watched);
            if (existing != null && existing > 0) {
                ops.unwatch();
                log.warn("Insert refused: strategy {} or one of its orders already exists", strategy.getId());
                return LedgerUpdateResult.conflict(null);
            }

            ops.multi();
            for (OrderRecord order : orders) {
                ops.opsForValue().set(RedisConfig.KEY_PREFIX_ORDER + order.getId(), JsonHelper.toJson(order));
                ops.opsForSet().add(RedisConfig.KEY_SET_ORDERS_ACTIVE, order.getId());
            }
            ops.opsForValue().set(RedisConfig.KEY_PREFIX_STRATEGY + strategy.getId(), JsonHelper.toJson(strategy));
            ops.opsForSet().add(RedisConfig.KEY_SET_STRATEGIES_ACTIVE, strategy.getId());
            return committed(ops.exec()) ? LedgerUpdateResult.applied() : null;
        });
    }

    @Override
    public LedgerUpdateResult compareAndSetStatus(String orderId, OrderStatus expected, StatusUpdate update) {
        String activeKey = RedisConfig.KEY_PREFIX_ORDER + orderId;

        return transact("compare-and-set order " + orderId, ops -> {
            ops.watch(activeKey);
            OrderRecord current = JsonHelper.fromJson(ops.opsForValue().get(activeKey), OrderRecord.class);
            if (current == null) {
                ops.unwatch();
                return missingOrder(ops, orderId);
            }
            if (current.getStatus() != expected || !update.versionMatches(current)) {
                ops.unwatch();
                return LedgerUpdateResult.conflict(current);
            }

            OrderRecord updated = update.applyTo(current);
            ops.multi();
            ops.opsForValue().set(activeKey, JsonHelper.toJson(updated));
            return committed(ops.exec()) ? LedgerUpdateResult.applied(updated) : null;
        });
    }

    @Override
    public LedgerUpdateResult moveToHistory(String orderId) {
        String activeKey = RedisConfig.KEY_PREFIX_ORDER + orderId;

        return transact("archive order " + orderId, ops -> {
            ops.watch(activeKey);
            String json = ops.opsForValue().get(activeKey);
            OrderRecord current = JsonHelper.fromJson(json, OrderRecord.class);
            if (current == null) {
                ops.unwatch();
                return missingOrder(ops, orderId);
            }
            if (!current.getStatus().isTerminal()) {
                ops.unwatch();
                return LedgerUpdateResult.notTerminal(current);
            }

            ops.multi();
            ops.opsForValue().set(RedisConfig.KEY_PREFIX_HISTORY_ORDER + orderId, json);
            ops.delete(activeKey);
            ops.opsForSet().remove(RedisConfig.KEY_SET_ORDERS_ACTIVE, orderId);
            ops.opsForSet().add(RedisConfig.KEY_SET_ORDERS_HISTORY, orderId);
            return committed(ops.exec()) ? LedgerUpdateResult.applied(current) : null;
        });
    }

    @Override
    public LedgerUpdateResult moveStrategyToHistory(String strategyId) {
        String activeKey = RedisConfig.KEY_PREFIX_STRATEGY + strategyId;
        String historyKey = RedisConfig.KEY_PREFIX_HISTORY_STRATEGY + strategyId;

        return transact("archive strategy " + strategyId, ops -> {
            ops.watch(activeKey);
            String json = ops.opsForValue().get(activeKey);
            if (json == null) {
                ops.unwatch();
                return Boolean.TRUE.equals(ops.hasKey(historyKey))
                        ? LedgerUpdateResult.archived(null)
                        : LedgerUpdateResult.notFound();
            }

            ops.multi();
            ops.opsForValue().set(historyKey, json);
            ops.delete(activeKey);
            ops.opsForSet().remove(RedisConfig.KEY_SET_STRATEGIES_ACTIVE, strategyId);
            ops.opsForSet().add(RedisConfig.KEY_SET_STRATEGIES_HISTORY, strategyId);
            return committed(ops.exec()) ? LedgerUpdateResult.applied() : null;
        });
    }

    // ==== Reads ====

    @Override
    public Optional<OrderRecord> findOrder(String orderId) {
        return read("find order " + orderId, () -> {
            String json = stringRedisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_ORDER + orderId);
            if (json == null) {
                json = stringRedisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_HISTORY_ORDER + orderId);
            }
            return Optional.ofNullable(JsonHelper.fromJson(json, OrderRecord.class));
        });
    }

    @Override
    public Optional<StrategyRecord> findStrategy(String strategyId, LedgerPartition partition) {
        return read("find strategy " + strategyId, () -> {
            String json = null;
            if (partition != LedgerPartition.HISTORY) {
                json = stringRedisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_STRATEGY + strategyId);
            }
            if (json == null && partition != LedgerPartition.ACTIVE) {
                json = stringRedisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_HISTORY_STRATEGY + strategyId);
            }
            return Optional.ofNullable(JsonHelper.fromJson(json, StrategyRecord.class));
        });
    }

    @Override
    public List<OrderRecord> listOrders(LedgerFilter filter) {
        return read("list orders", () -> {
            Map<String, OrderRecord> byId = new LinkedHashMap<>();
            if (filter.getPartition() != LedgerPartition.HISTORY) {
                fetch(RedisConfig.KEY_SET_ORDERS_ACTIVE, RedisConfig.KEY_PREFIX_ORDER, OrderRecord.class)
                        .forEach(o -> byId.put(o.getId(), o));
            }
            if (filter.getPartition() != LedgerPartition.ACTIVE) {
                fetch(RedisConfig.KEY_SET_ORDERS_HISTORY, RedisConfig.KEY_PREFIX_HISTORY_ORDER, OrderRecord.class)
                        .forEach(o -> byId.putIfAbsent(o.getId(), o));
            }
            return byId.values().stream()
                    .filter(filter::matches)
                    .sorted(ORDER_SEQUENCE)
                    .toList();
        });
    }

    @Override
    public List<StrategyRecord> listStrategies(LedgerPartition partition) {
        return read("list strategies", () -> {
            Map<String, StrategyRecord> byId = new LinkedHashMap<>();
            if (partition != LedgerPartition.HISTORY) {
                fetch(RedisConfig.KEY_SET_STRATEGIES_ACTIVE, RedisConfig.KEY_PREFIX_STRATEGY, StrategyRecord.class)
                        .forEach(s -> byId.put(s.getId(), s));
            }
            if (partition != LedgerPartition.ACTIVE) {
                fetch(
                                RedisConfig.KEY_SET_STRATEGIES_HISTORY,
                                RedisConfig.KEY_PREFIX_HISTORY_STRATEGY,
                                StrategyRecord.class)
                        .forEach(s -> byId.putIfAbsent(s.getId(), s));
            }
            return byId.values().stream().sorted(STRATEGY_SEQUENCE).toList();
        });
    }

    @Override
    public int countOrders(LedgerPartition partition) {
        return read("count orders", () -> {
            long count = 0;
            if (partition != LedgerPartition.HISTORY) {
                count += size(RedisConfig.KEY_SET_ORDERS_ACTIVE);
            }
            if (partition != LedgerPartition.ACTIVE) {
                count += size(RedisConfig.KEY_SET_ORDERS_HISTORY);
            }
            return (int) count;
        });
    }

    // ==== Internals ====

    /** One optimistic attempt. Returns null when EXEC was discarded and the attempt must be retried. */
    @FunctionalInterface
    interface TransactionalWrite {
        LedgerUpdateResult attempt(RedisOperations<String, String> ops);
    }

    private LedgerUpdateResult transact(String description, TransactionalWrite write) {
        for (int attempt = 1; attempt <= RedisConfig.MAX_TRANSACTION_ATTEMPTS; attempt++) {
            LedgerUpdateResult result;
            try {
                result = stringRedisTemplate.execute(new SessionCallback<LedgerUpdateResult>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> LedgerUpdateResult execute(RedisOperations<K, V> operations) {
                        return write.attempt((RedisOperations<String, String>) operations);
                    }
                });
            } catch (DataAccessException e) {
                log.error("Redis failure during {}", description, e);
                throw new LedgerUnavailableException("Staging ledger unavailable during " + description, e);
            }
            if (result != null) {
                return result;
            }
            log.debug("Transaction for {} discarded by a concurrent write, attempt {}", description, attempt);
        }
        log.error("Gave up on {} after {} contended attempts", description, RedisConfig.MAX_TRANSACTION_ATTEMPTS);
        throw new LedgerUnavailableException(
                "Staging ledger too contended to " + description + " after "
                        + RedisConfig.MAX_TRANSACTION_ATTEMPTS + " attempts",
                null);
    }

    private <T> T read(String description, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Redis failure during {}", description, e);
            throw new LedgerUnavailableException("Staging ledger unavailable during " + description, e);
        }
    }

    private static LedgerUpdateResult missingOrder(RedisOperations<String, String> ops, String orderId) {
        OrderRecord archived = JsonHelper.fromJson(
                ops.opsForValue().get(RedisConfig.KEY_PREFIX_HISTORY_ORDER + orderId), OrderRecord.class);
        return archived != null ? LedgerUpdateResult.archived(archived) : LedgerUpdateResult.notFound();
    }

    /** EXEC returns null or an empty list when a watched key changed. */
    private static boolean committed(List<Object> execResult) {
        return execResult != null && !execResult.isEmpty();
    }

    private <T> List<T> fetch(String idSetKey, String keyPrefix, Class<T> type) {
        Set<String> ids = stringRedisTemplate.opsForSet().members(idSetKey);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }

        // Single round-trip for all records
        Collection<String> keys = ids.stream().map(id -> keyPrefix + id).toList();
        List<String> values = stringRedisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(json -> JsonHelper.fromJson(json, type))
                .toList();
    }

    private long size(String idSetKey) {
        Long size = stringRedisTemplate.opsForSet().size(idSetKey);
        return size != null ? size : 0;
    }
}
