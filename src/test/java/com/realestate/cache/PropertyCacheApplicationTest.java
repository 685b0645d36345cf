package com.realestate.cache;

import com.realestate.cache.constant.CacheSource;
import com.realestate.cache.dto.CacheLookup;
import com.realestate.cache.health.CacheHealthIndicator;
import com.realestate.cache.service.TierManager;
import com.realestate.cache.tier.CaffeineVolatileTier;
import com.realestate.cache.tier.InMemoryDurableTier;
import com.realestate.cache.tier.VolatileTier;
import com.realestate.cache.tier.DurableTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Spring Boot 应用启动测试
 */
@SpringBootTest
@ActiveProfiles("test")
class PropertyCacheApplicationTest {

    @Autowired
    private TierManager tierManager;

    @Autowired
    private VolatileTier volatileTier;

    @Autowired
    private DurableTier durableTier;

    @Autowired
    private CacheHealthIndicator cacheHealthIndicator;

    @Autowired
    @Qualifier("cacheWarmupExecutor")
    private ThreadPoolTaskExecutor cacheWarmupExecutor;

    @Test
    @DisplayName("应用上下文加载，测试配置选用本地层实现")
    void contextLoads() {
        assertInstanceOf(CaffeineVolatileTier.class, volatileTier);
        assertInstanceOf(InMemoryDurableTier.class, durableTier);
        assertEquals(Status.UP, cacheHealthIndicator.health().getStatus());
        assertEquals("cache-warmer-", cacheWarmupExecutor.getThreadNamePrefix());
    }

    @Test
    @DisplayName("装配后的缓存引擎可读写")
    void testWiredRoundTrip() throws Exception {
        Map<String, Object> params = Map.of("city", "Houston", "maxPrice", 300000);
        tierManager.set("discovery", params, Map.of("count", 42)).get(5, TimeUnit.SECONDS);

        CacheLookup<Map> lookup = tierManager.get("discovery", params, Map.class).get(5, TimeUnit.SECONDS);

        assertEquals(CacheSource.VOLATILE, lookup.source());
        assertEquals(42, lookup.data().get("count"));
    }
}
