package com.realestate.cache.tier;

import com.realestate.cache.config.JacksonConfig;
import com.realestate.cache.repository.CacheRecordRepository;
import com.realestate.cache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JPA 持久层测试（H2）
 */
@DataJpaTest
@ActiveProfiles("test")
class JpaDurableTierTest {

    private static final Map<String, Object> PARAMS = Map.of("city", "houston", "beds", 3, "types", List.of("condo", "house"));

    @Autowired
    private CacheRecordRepository repository;

    private MutableClock clock;
    private JpaDurableTier durableTier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        durableTier = new JpaDurableTier(repository, JacksonConfig.cacheObjectMapper(), clock);
    }

    private DurableWrite write(String key, long ttlSeconds) {
        return new DurableWrite(key, "discovery", PARAMS, "{\"count\":2}", ttlSeconds, 0.10,
            Map.of("cacheType", "discovery", "warmed", true));
    }

    @Test
    @DisplayName("写入后按参数读取并更新访问统计")
    void testUpsertAndFind() {
        DurableRecord inserted = durableTier.upsert(write("discovery:aaaa", 3600));
        assertEquals(1, inserted.accessCount());

        clock.advance(Duration.ofMinutes(1));
        DurableRecord hit = durableTier.findByParams("discovery:aaaa", PARAMS).orElseThrow();

        assertEquals("{\"count\":2}", hit.payloadJson());
        assertEquals(2, hit.accessCount());
        assertEquals(0.10, hit.cumulativeCostSaved(), 1e-9);
        assertEquals(true, hit.metadata().get("warmed"));

        durableTier.findByParams("discovery:aaaa", PARAMS);
        assertEquals(3, repository.findById("discovery:aaaa").orElseThrow().getAccessCount());
        assertEquals(0.20, repository.findById("discovery:aaaa").orElseThrow().getCostSaved(), 1e-9);
    }

    @Test
    @DisplayName("参数不一致视为碰撞")
    void testCollisionGuard() {
        durableTier.upsert(write("discovery:aaaa", 3600));

        assertTrue(durableTier.findByParams("discovery:aaaa", Map.of("city", "dallas")).isEmpty());
        assertEquals(1, repository.findById("discovery:aaaa").orElseThrow().getAccessCount());
    }

    @Test
    @DisplayName("过期条目读取时过滤，清理时物理删除")
    void testExpiry() {
        durableTier.upsert(write("discovery:aaaa", 60));
        clock.advance(Duration.ofSeconds(120));

        assertTrue(durableTier.findByParams("discovery:aaaa", PARAMS).isEmpty());
        assertEquals(1, durableTier.purgeExpired());
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("重复写入刷新过期时间并递增访问次数")
    void testReUpsert() {
        durableTier.upsert(write("discovery:aaaa", 60));
        clock.advance(Duration.ofSeconds(30));

        DurableRecord record = durableTier.upsert(write("discovery:aaaa", 60));

        assertEquals(2, record.accessCount());
        assertEquals(clock.instant().plusSeconds(60), record.expiresAt());
    }

    @Test
    @DisplayName("按正则删除与单 Key 删除")
    void testDeletes() {
        durableTier.upsert(write("discovery:aaaa", 3600));
        durableTier.upsert(write("discovery:bbbb", 3600));
        durableTier.upsert(write("address:cccc", 3600));

        assertEquals(2, durableTier.deleteMatching(Pattern.compile("^DISCOVERY:", Pattern.CASE_INSENSITIVE)));
        assertTrue(durableTier.delete("address:cccc"));
        assertFalse(durableTier.delete("address:cccc"));
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("冷数据清理与汇总")
    void testPurgeStaleAndSummarize() {
        durableTier.upsert(write("discovery:cold", Duration.ofDays(30).toSeconds()));
        durableTier.upsert(write("discovery:hot", Duration.ofDays(30).toSeconds()));
        durableTier.findByParams("discovery:hot", PARAMS);

        DurableTierSummary summary = durableTier.summarize();
        assertEquals(2, summary.totalEntries());
        assertEquals(3, summary.totalAccesses());
        assertEquals(0.10, summary.totalCostSaved(), 1e-9);

        clock.advance(Duration.ofDays(8));
        assertEquals(1, durableTier.purgeStale(Duration.ofDays(7), 2));
        assertTrue(repository.existsById("discovery:hot"));
    }
}
