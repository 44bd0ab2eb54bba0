package com.worldhub.tradeservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 封装 Hash/List/脚本 等原语操作；
 * - 业务键名与字段名放在 Repo 层组织；
 * - 背包、金币、在线目录都是可读的字符串 Hash，统一走 StringRedisTemplate。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 字符串模板：用于纯字符串 Hash / List */
    private final StringRedisTemplate strRedis;

    // -------------- Hash（字符串） --------------

    /**
     * 获取单个 Hash 字段
     */
    public String hGetStr(String key, String field) {
        Object v = strRedis.opsForHash().get(key, field);
        return v == null ? null : String.valueOf(v);
    }

    /**
     * 获取整个 Hash
     */
    public Map<String, String> hGetAllStr(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    /**
     * 写入 Hash 字段
     */
    public void hSetStr(String key, String field, String val) {
        strRedis.opsForHash().put(key, field, val);
    }

    /**
     * 批量写入 Hash
     */
    public void hSetAllStr(String key, Map<String, String> map) {
        if (map.isEmpty()) return;
        strRedis.opsForHash().putAll(key, map);
    }

    /**
     * 删除指定 Hash 字段
     */
    public Long hDelStr(String key, String... fields) {
        if (fields.length == 0) return 0L;
        return strRedis.opsForHash().delete(key, (Object[]) fields);
    }

    /**
     * Hash 字段自增（整数）
     * @return 新值
     */
    public Long hIncrByStr(String key, String field, long delta) {
        return strRedis.opsForHash().increment(key, field, delta);
    }

    // -------------- List --------------

    /**
     * 左侧追加（最新的在最前）
     */
    public Long lPushStr(String key, String val) {
        return strRedis.opsForList().leftPush(key, val);
    }

    /**
     * 读取区间 [start, end]
     */
    public List<String> lRangeStr(String key, long start, long end) {
        List<String> out = strRedis.opsForList().range(key, start, end);
        return out == null ? Collections.emptyList() : out;
    }

    // -------------- Script --------------

    /**
     * 执行 Lua 脚本（原子操作），参数与返回均为字符串序列化。
     *
     * @param script     Lua 文本内容
     * @param keys       KEYS[...] 参数列表
     * @param args       ARGV[...] 参数列表
     * @param resultType 返回类型（Long / String / Boolean / List）
     * @return 脚本执行结果
     */
    public <T> T evalStr(String script, List<String> keys, List<String> args, Class<T> resultType) {
        DefaultRedisScript<T> rs = new DefaultRedisScript<>();
        rs.setResultType(resultType);
        rs.setScriptText(script);
        return strRedis.execute(rs, keys, args.toArray());
    }
}
