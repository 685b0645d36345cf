package com.realestate.cache.maintenance;

import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.support.MutableClock;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.DurableWrite;
import com.realestate.cache.tier.InMemoryDurableTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 持久层清理任务单元测试
 */
class DurableTierJanitorTest {

    private static final Map<String, Object> PARAMS = Map.of("zip", "77002");

    private MutableClock clock;
    private InMemoryDurableTier durableTier;
    private DurableTierJanitor janitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        durableTier = new InMemoryDurableTier(clock);
        janitor = new DurableTierJanitor(durableTier, new CacheProperties());
    }

    private void put(String key, Duration ttl) {
        durableTier.upsert(new DurableWrite(key, "address", PARAMS, "{}", ttl.toSeconds(), 0.05, Map.of()));
    }

    @Test
    @DisplayName("清理过期与冷数据，保留热数据")
    void testCleanup() {
        put("address:expiring", Duration.ofHours(1));
        put("address:cold", Duration.ofDays(30));
        put("address:hot", Duration.ofDays(30));
        durableTier.findByParams("address:hot", PARAMS);

        clock.advance(Duration.ofDays(8));

        assertEquals(2, janitor.cleanup());
        assertEquals(1, durableTier.summarize().totalEntries());
    }

    @Test
    @DisplayName("未过期且近期访问的数据不清理")
    void testNothingToRemove() {
        put("address:fresh", Duration.ofDays(30));

        assertEquals(0, janitor.cleanup());
    }

    @Test
    @DisplayName("定时任务吸收持久层故障")
    void testScheduledCleanupAbsorbsFaults() {
        DurableTier brokenTier = mock(DurableTier.class);
        when(brokenTier.purgeExpired()).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> new DurableTierJanitor(brokenTier, new CacheProperties()).scheduledCleanup());
    }
}
