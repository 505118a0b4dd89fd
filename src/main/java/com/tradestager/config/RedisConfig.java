package com.tradestager.config;

import java.time.Duration;

/**
 * Redis key schema for the Redis-backed staging ledger and daily loss tracker.
 *
 * <p>All keys are prefixed with "stager:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   stager:order:{id}                  → active OrderRecord JSON
 *   stager:history:order:{id}          → archived OrderRecord JSON
 *   stager:strategy:{id}               → active StrategyRecord JSON
 *   stager:history:strategy:{id}       → archived StrategyRecord JSON
 *   stager:orders:active               → Set of active order ids
 *   stager:orders:history              → Set of archived order ids
 *   stager:strategies:active           → Set of active strategy ids
 *   stager:strategies:history          → Set of archived strategy ids
 *   stager:daily-loss:{yyyy-MM-dd}     → realized loss in integer cents (INCRBY)
 * </pre>
 *
 * <p>Ledger records carry no TTL; they are removed only by an operator. Daily loss counters
 * expire after {@link #DAILY_LOSS_TTL}.
 */
public final class RedisConfig {

    public static final String KEY_PREFIX = "stager:";

    public static final String KEY_PREFIX_ORDER = KEY_PREFIX + "order:";
    public static final String KEY_PREFIX_HISTORY_ORDER = KEY_PREFIX + "history:order:";
    public static final String KEY_PREFIX_STRATEGY = KEY_PREFIX + "strategy:";
    public static final String KEY_PREFIX_HISTORY_STRATEGY = KEY_PREFIX + "history:strategy:";
    public static final String KEY_PREFIX_DAILY_LOSS = KEY_PREFIX + "daily-loss:";

    public static final String KEY_SET_ORDERS_ACTIVE = KEY_PREFIX + "orders:active";
    public static final String KEY_SET_ORDERS_HISTORY = KEY_PREFIX + "orders:history";
    public static final String KEY_SET_STRATEGIES_ACTIVE = KEY_PREFIX + "strategies:active";
    public static final String KEY_SET_STRATEGIES_HISTORY = KEY_PREFIX + "strategies:history";

    public static final Duration DAILY_LOSS_TTL = Duration.ofDays(3);

    /** WATCH/MULTI/EXEC attempts before a contended write is reported as unavailable. */
    public static final int MAX_TRANSACTION_ATTEMPTS = 5;

    public static final String LEDGER_BACKEND_PROPERTY = "tradestager.ledger.backend";

    private RedisConfig() {}
}
