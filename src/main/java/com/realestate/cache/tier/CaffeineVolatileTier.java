package com.realestate.cache.tier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Expiry;

import java.util.concurrent.TimeUnit;

/**
 * 本地 Caffeine 易失层（单机部署 / 测试使用）
 * 每个条目携带自己的 TTL，通过 {@link EntryExpiry} 实现逐条过期
 */
public class CaffeineVolatileTier implements VolatileTier {

    private final Cache<String, LocalEntry> cache;

    public CaffeineVolatileTier(Cache<String, LocalEntry> cache) {
        this.cache = cache;
    }

    @Override
    public String name() {
        return "caffeine";
    }

    @Override
    public String get(String key) {
        LocalEntry entry = cache.getIfPresent(key);
        return entry != null ? entry.value() : null;
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return;
        }
        cache.put(key, new LocalEntry(value, TimeUnit.SECONDS.toNanos(ttlSeconds)));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 本地条目
     *
     * @param value    JSON 文本
     * @param ttlNanos 存活时间（纳秒）
     */
    public record LocalEntry(String value, long ttlNanos) {
    }

    /**
     * 写入（含覆盖写）时按条目 TTL 重置过期时间，读取不续期
     */
    public static class EntryExpiry implements Expiry<String, LocalEntry> {

        @Override
        public long expireAfterCreate(String key, LocalEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, LocalEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, LocalEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
