package com.realestate.cache.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.realestate.cache.tier.CaffeineVolatileTier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 本地易失层配置
 * 仅在 property-cache.volatile-tier.mode=local 时启用（单机部署 / 测试）
 */
@Configuration
@ConditionalOnProperty(prefix = "property-cache.volatile-tier", name = "mode", havingValue = "local")
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    @Bean("volatileLocalCache")
    public Cache<String, CaffeineVolatileTier.LocalEntry> volatileLocalCache(CacheProperties cacheProperties,
                                                                              MeterRegistry meterRegistry) {
        long maximumSize = cacheProperties.getVolatileTier().getMaximumSize();
        Cache<String, CaffeineVolatileTier.LocalEntry> cache = volatileCache(maximumSize, Ticker.systemTicker());

        // 注册 Micrometer 指标
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "property_volatile_cache");

        log.info("Local volatile cache initialized: maximumSize={}", maximumSize);
        return cache;
    }

    /**
     * 构建逐条过期的本地缓存，测试中可传入假 Ticker 控制时间
     */
    public static Cache<String, CaffeineVolatileTier.LocalEntry> volatileCache(long maximumSize, Ticker ticker) {
        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new CaffeineVolatileTier.EntryExpiry())
            .ticker(ticker)
            .recordStats()
            .removalListener((String key, CaffeineVolatileTier.LocalEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Volatile entry evicted due to size: key={}", key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Volatile entry expired: key={}", key);
                }
            })
            .build();
    }
}
