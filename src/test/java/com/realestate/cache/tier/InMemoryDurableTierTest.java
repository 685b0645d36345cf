package com.realestate.cache.tier;

import com.realestate.cache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存持久层单元测试
 */
class InMemoryDurableTierTest {

    private static final Map<String, Object> PARAMS = Map.of("city", "houston");

    private MutableClock clock;
    private InMemoryDurableTier durableTier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        durableTier = new InMemoryDurableTier(clock);
    }

    private DurableWrite write(String key, Map<String, Object> params, long ttlSeconds) {
        return new DurableWrite(key, "discovery", params, "{\"count\":1}", ttlSeconds, 0.10, Map.of("warmed", true));
    }

    @Test
    @DisplayName("首次写入 accessCount 为 1")
    void testInsert() {
        DurableRecord record = durableTier.upsert(write("discovery:aaaa", PARAMS, 3600));

        assertEquals(1, record.accessCount());
        assertEquals(0.0, record.cumulativeCostSaved());
        assertEquals(clock.instant().plusSeconds(3600), record.expiresAt());
        assertEquals(true, record.metadata().get("warmed"));
    }

    @Test
    @DisplayName("命中递增访问次数并累计节省成本")
    void testHitUpdatesAccessStats() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 3600));
        clock.advance(Duration.ofMinutes(5));

        durableTier.findByParams("discovery:aaaa", PARAMS);
        DurableRecord record = durableTier.findByParams("discovery:aaaa", PARAMS).orElseThrow();

        assertEquals(3, record.accessCount());
        assertEquals(0.20, record.cumulativeCostSaved(), 1e-9);
        assertEquals(clock.instant(), record.lastAccessedAt());
    }

    @Test
    @DisplayName("重复写入刷新载荷与过期时间，并计为一次访问")
    void testReUpsert() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 60));
        clock.advance(Duration.ofSeconds(30));

        DurableRecord record = durableTier.upsert(write("discovery:aaaa", PARAMS, 60));

        assertEquals(2, record.accessCount());
        assertEquals(clock.instant().plusSeconds(60), record.expiresAt());
    }

    @Test
    @DisplayName("参数不一致视为哈希碰撞，返回未命中")
    void testCollisionGuard() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 3600));

        Optional<DurableRecord> result = durableTier.findByParams("discovery:aaaa", Map.of("city", "dallas"));

        assertTrue(result.isEmpty());
        // 碰撞读取不计入访问次数
        assertEquals(2, durableTier.findByParams("discovery:aaaa", PARAMS).orElseThrow().accessCount());
    }

    @Test
    @DisplayName("过期条目不返回")
    void testExpiredNotReturned() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 60));
        clock.advance(Duration.ofSeconds(61));

        assertTrue(durableTier.findByParams("discovery:aaaa", PARAMS).isEmpty());
    }

    @Test
    @DisplayName("按正则删除")
    void testDeleteMatching() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 3600));
        durableTier.upsert(write("discovery:bbbb", PARAMS, 3600));
        durableTier.upsert(write("address:cccc", PARAMS, 3600));

        int deleted = durableTier.deleteMatching(Pattern.compile("^discovery:"));

        assertEquals(2, deleted);
        assertEquals(1, durableTier.summarize().totalEntries());
    }

    @Test
    @DisplayName("清理过期与冷数据")
    void testPurge() {
        durableTier.upsert(write("discovery:expiring", PARAMS, 60));
        durableTier.upsert(write("discovery:cold", PARAMS, Duration.ofDays(30).toSeconds()));
        durableTier.upsert(write("discovery:hot", PARAMS, Duration.ofDays(30).toSeconds()));
        durableTier.findByParams("discovery:hot", PARAMS);

        clock.advance(Duration.ofDays(8));

        assertEquals(1, durableTier.purgeExpired());
        assertEquals(1, durableTier.purgeStale(Duration.ofDays(7), 2));
        assertEquals(1, durableTier.summarize().totalEntries());
        assertTrue(durableTier.findByParams("discovery:hot", PARAMS).isPresent());
    }

    @Test
    @DisplayName("汇总统计")
    void testSummarize() {
        durableTier.upsert(write("discovery:aaaa", PARAMS, 3600));
        durableTier.findByParams("discovery:aaaa", PARAMS);
        durableTier.upsert(write("discovery:bbbb", PARAMS, 3600));

        DurableTierSummary summary = durableTier.summarize();

        assertEquals(2, summary.totalEntries());
        assertEquals(3, summary.totalAccesses());
        assertEquals(0.10, summary.totalCostSaved(), 1e-9);
    }
}
