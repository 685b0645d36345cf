package com.realestate.cache.tier;

import com.realestate.cache.config.CaffeineConfig;
import com.realestate.cache.support.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 本地易失层单元测试
 */
class CaffeineVolatileTierTest {

    private FakeTicker ticker;
    private CaffeineVolatileTier volatileTier;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        volatileTier = new CaffeineVolatileTier(CaffeineConfig.volatileCache(100, ticker));
    }

    @Test
    @DisplayName("写入和读取")
    void testSetAndGet() {
        volatileTier.set("discovery:abc", "{\"count\":3}", 60);

        assertEquals("{\"count\":3}", volatileTier.get("discovery:abc"));
        assertNull(volatileTier.get("discovery:missing"));
    }

    @Test
    @DisplayName("条目按各自 TTL 过期")
    void testPerEntryExpiry() {
        volatileTier.set("short", "1", 1);
        volatileTier.set("long", "2", 60);

        ticker.advance(Duration.ofSeconds(2));

        assertNull(volatileTier.get("short"));
        assertEquals("2", volatileTier.get("long"));
    }

    @Test
    @DisplayName("读取不续期，覆盖写重置 TTL")
    void testReadDoesNotExtend() {
        volatileTier.set("key", "v1", 10);
        ticker.advance(Duration.ofSeconds(8));
        assertEquals("v1", volatileTier.get("key"));

        ticker.advance(Duration.ofSeconds(3));
        assertNull(volatileTier.get("key"));

        volatileTier.set("key", "v2", 10);
        ticker.advance(Duration.ofSeconds(8));
        volatileTier.set("key", "v3", 10);
        ticker.advance(Duration.ofSeconds(8));
        assertEquals("v3", volatileTier.get("key"));
    }

    @Test
    @DisplayName("非正 TTL 不写入")
    void testNonPositiveTtlSkipped() {
        volatileTier.set("key", "value", 0);
        assertNull(volatileTier.get("key"));
    }

    @Test
    @DisplayName("删除")
    void testDelete() {
        volatileTier.set("key", "value", 60);
        volatileTier.delete("key");
        assertNull(volatileTier.get("key"));
    }
}
