package com.worldhub.tradeservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 模板配置（基础设施层，无业务耦合）
 * -------------------------------------------------------
 * 交易服务读写的背包、金币、在线目录均为可读字符串 Hash
 * （与世界服其他模块共享数据格式），因此只使用 StringRedisTemplate，
 * 不配置 JSON 序列化的 RedisTemplate。
 */
@Configuration
public class RedisConfig {

    /**
     * 纯字符串操作模板
     *
     * @param factory Redis 连接工厂（Lettuce）
     * @return StringRedisTemplate Bean
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
