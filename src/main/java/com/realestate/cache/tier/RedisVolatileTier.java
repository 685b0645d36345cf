package com.realestate.cache.tier;

import com.realestate.cache.exception.VolatileTierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Redis 易失层
 * TTL 由 Redis 原生过期实现；这里不加随机扰动，调用方给定的 TTL 即实际过期时间
 */
public class RedisVolatileTier implements VolatileTier {

    private static final Logger log = LoggerFactory.getLogger(RedisVolatileTier.class);

    private final StringRedisTemplate redisTemplate;

    public RedisVolatileTier(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            throw new VolatileTierException("Redis get failed, key: " + key, e);
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            log.debug("Skip Redis set with non-positive TTL, key: {}", key);
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, value, ttlSeconds, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            throw new VolatileTierException("Redis set failed, key: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            throw new VolatileTierException("Redis delete failed, key: " + key, e);
        }
    }
}
