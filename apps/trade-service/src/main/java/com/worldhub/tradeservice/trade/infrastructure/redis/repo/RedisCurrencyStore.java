package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.worldhub.tradeservice.infrastructure.redis.RedisOps;
import com.worldhub.tradeservice.trade.domain.repository.CurrencyStore;
import com.worldhub.tradeservice.trade.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 金币存储：world:player:{userId}:stats 的 gold 字段。
 * 扣款用 Lua 脚本做"余额检查 + 扣减"，避免并发扣成负数。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisCurrencyStore implements CurrencyStore {

    /**
     * KEYS[1] = stats key
     * ARGV[1] = gold 字段名
     * ARGV[2] = 扣除数量
     * 返回：1 扣除成功；0 余额不足
     */
    static final String REMOVE_GOLD_LUA = """
            local cur = tonumber(redis.call('HGET', KEYS[1], ARGV[1]) or '0')
            local amt = tonumber(ARGV[2])
            if cur < amt then
              return 0
            end
            redis.call('HINCRBY', KEYS[1], ARGV[1], -amt)
            return 1
            """;

    private final RedisOps ops;

    @Override
    public long getGold(String userId) {
        return NumberUtils.toLong(ops.hGetStr(RedisKeys.stats(userId), RedisKeys.GOLD_FIELD), 0L);
    }

    @Override
    public boolean removeGold(String userId, long amount) {
        if (amount <= 0) return false;
        Long ok = ops.evalStr(REMOVE_GOLD_LUA,
                List.of(RedisKeys.stats(userId)),
                List.of(RedisKeys.GOLD_FIELD, String.valueOf(amount)),
                Long.class);
        if (ok == null || ok != 1L) {
            log.debug("金币不足: userId={}, amount={}", userId, amount);
            return false;
        }
        return true;
    }

    @Override
    public long addGold(String userId, long amount) {
        if (amount <= 0) return getGold(userId);
        Long v = ops.hIncrByStr(RedisKeys.stats(userId), RedisKeys.GOLD_FIELD, amount);
        return v == null ? 0L : v;
    }
}
