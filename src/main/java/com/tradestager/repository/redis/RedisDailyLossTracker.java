package com.tradestager.repository.redis;

import com.tradestager.config.RedisConfig;
import com.tradestager.exception.LedgerUnavailableException;
import com.tradestager.risk.DailyLossTracker;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed {@link DailyLossTracker}. Losses are kept as integer cents under
 * {@code stager:daily-loss:{date}} and accumulated with INCRBY, which is atomic on the server,
 * so concurrent recorders across processes never lose an increment.
 */
@Repository
@ConditionalOnProperty(name = RedisConfig.LEDGER_BACKEND_PROPERTY, havingValue = "redis")
public class RedisDailyLossTracker implements DailyLossTracker {

    private static final Logger log = LoggerFactory.getLogger(RedisDailyLossTracker.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDailyLossTracker(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public BigDecimal recordTradeResult(LocalDate tradeDate, BigDecimal pnl) {
        if (pnl == null || pnl.signum() >= 0) {
            return getDailyLoss(tradeDate);
        }
        String key = key(tradeDate);
        long cents = pnl.abs().movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
        try {
            Long total = stringRedisTemplate.opsForValue().increment(key, cents);
            stringRedisTemplate.expire(key, RedisConfig.DAILY_LOSS_TTL);
            BigDecimal loss = total != null ? BigDecimal.valueOf(total, 2) : BigDecimal.ZERO;
            log.debug("Recorded loss {} for {}, daily total: {}", pnl.abs(), tradeDate, loss);
            return loss;
        } catch (DataAccessException e) {
            log.error("Failed to record daily loss for {}", tradeDate, e);
            throw new LedgerUnavailableException("Daily loss tracker unavailable", e);
        }
    }

    @Override
    public BigDecimal getDailyLoss(LocalDate tradeDate) {
        try {
            String value = stringRedisTemplate.opsForValue().get(key(tradeDate));
            return value != null ? BigDecimal.valueOf(Long.parseLong(value), 2) : BigDecimal.ZERO;
        } catch (DataAccessException e) {
            log.error("Failed to read daily loss for {}", tradeDate, e);
            throw new LedgerUnavailableException("Daily loss tracker unavailable", e);
        }
    }

    private static String key(LocalDate tradeDate) {
        return RedisConfig.KEY_PREFIX_DAILY_LOSS + tradeDate;
    }
}
