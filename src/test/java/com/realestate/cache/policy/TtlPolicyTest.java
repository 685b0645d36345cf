package com.realestate.cache.policy;

import com.realestate.cache.exception.NormalizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TTL 策略单元测试
 */
class TtlPolicyTest {

    private TtlPolicy ttlPolicy;

    @BeforeEach
    void setUp() {
        ttlPolicy = new TtlPolicy(Duration.ofHours(6));
    }

    @Test
    @DisplayName("已登记类别按策略表解析")
    void testKnownClass() {
        TtlRule rule = ttlPolicy.ruleFor("discovery");

        assertEquals(6 * 3600, rule.volatileSeconds());
        assertEquals(24 * 3600, rule.durableSeconds());
        assertTrue(rule.durableEligible());
        assertEquals(0.10, rule.estimatedUnitCost(), 1e-9);
    }

    @Test
    @DisplayName("类别名大小写不敏感")
    void testCaseInsensitiveLookup() {
        assertEquals(ttlPolicy.ruleFor("address"), ttlPolicy.ruleFor("  ADDRESS "));
    }

    @Test
    @DisplayName("未知类别使用默认行")
    void testUnknownClassFallsBack() {
        TtlRule rule = ttlPolicy.ruleFor("something_new");

        assertEquals(3600, rule.volatileSeconds());
        assertEquals(3600, rule.durableSeconds());
        assertFalse(rule.durableEligible());
        assertEquals(0.01, rule.estimatedUnitCost(), 1e-9);
    }

    @Test
    @DisplayName("易失层 TTL 受上限约束")
    void testVolatileCeiling() {
        assertEquals(6 * 3600, ttlPolicy.volatileTtlSeconds("details", null));
        assertEquals(6 * 3600, ttlPolicy.volatileTtlSeconds("details", Duration.ofDays(3).toSeconds()));
        assertEquals(120, ttlPolicy.volatileTtlSeconds("details", 120L));

        TtlPolicy tight = new TtlPolicy(Duration.ofHours(1));
        assertEquals(3600, tight.volatileTtlSeconds("discovery", null));
        assertEquals(3000, tight.volatileTtlSeconds("api_tokens", null));
    }

    @Test
    @DisplayName("持久层 TTL：显式值优先，否则按策略表")
    void testDurableTtl() {
        assertEquals(Duration.ofDays(30).toSeconds(), ttlPolicy.durableTtlSeconds("address", null));
        assertEquals(60, ttlPolicy.durableTtlSeconds("address", 60L));
    }

    @Test
    @DisplayName("显式 TTL 非正视为非法输入")
    void testNonPositiveRequestedTtl() {
        assertThrows(NormalizationException.class, () -> ttlPolicy.volatileTtlSeconds("address", 0L));
        assertThrows(NormalizationException.class, () -> ttlPolicy.durableTtlSeconds("address", -1L));
        assertDoesNotThrow(() -> TtlPolicy.requirePositive(null));
    }

    @Test
    @DisplayName("所有类别持久层 TTL 不短于有效易失层 TTL")
    void testDurableOutlivesVolatile() {
        for (CacheDataClass dataClass : CacheDataClass.values()) {
            TtlRule rule = ttlPolicy.ruleFor(dataClass.typeName());
            assertTrue(rule.durableSeconds() >= rule.volatileSeconds(), dataClass.typeName());
        }
    }

    @Test
    @DisplayName("上限必须为正")
    void testInvalidCeiling() {
        assertThrows(IllegalArgumentException.class, () -> new TtlPolicy(Duration.ZERO));
    }
}
