package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.worldhub.tradeservice.infrastructure.redis.RedisOps;
import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;
import com.worldhub.tradeservice.trade.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Optional;

/**
 * 在线玩家目录（Redis 两张 Hash 互为索引）：
 * - world:online:names：小写名字 -> userId
 * - world:online:ids：userId -> 展示名
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisPlayerDirectory implements PlayerDirectory {

    private final RedisOps ops;

    @Override
    public Optional<String> findUserByName(String name) {
        if (StringUtils.isBlank(name)) return Optional.empty();
        String userId = ops.hGetStr(RedisKeys.onlineNames(), normalize(name));
        return StringUtils.isBlank(userId) ? Optional.empty() : Optional.of(userId);
    }

    @Override
    public String getDisplayName(String userId) {
        String name = ops.hGetStr(RedisKeys.onlineIds(), userId);
        return StringUtils.isBlank(name) ? "Player" + userId : name;
    }

    @Override
    public void register(String userId, String displayName) {
        String name = StringUtils.defaultIfBlank(displayName, "Player" + userId);
        // 同一用户改名后重新连接：先清掉旧名字的索引
        String previous = ops.hGetStr(RedisKeys.onlineIds(), userId);
        if (previous != null && !normalize(previous).equals(normalize(name))) {
            ops.hDelStr(RedisKeys.onlineNames(), normalize(previous));
        }
        ops.hSetStr(RedisKeys.onlineIds(), userId, name);
        ops.hSetStr(RedisKeys.onlineNames(), normalize(name), userId);
        log.debug("玩家上线登记: userId={}, name={}", userId, name);
    }

    @Override
    public void unregister(String userId) {
        String name = ops.hGetStr(RedisKeys.onlineIds(), userId);
        ops.hDelStr(RedisKeys.onlineIds(), userId);
        if (name != null) {
            String key = normalize(name);
            // 名字可能已被同名新连接占用，仅删除仍指向自己的索引
            if (userId.equals(ops.hGetStr(RedisKeys.onlineNames(), key))) {
                ops.hDelStr(RedisKeys.onlineNames(), key);
            }
        }
        log.debug("玩家下线注销: userId={}", userId);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
