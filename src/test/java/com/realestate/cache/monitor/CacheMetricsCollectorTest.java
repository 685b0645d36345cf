package com.realestate.cache.monitor;

import com.realestate.cache.stats.StatsCollector;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.DurableTierSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 监控指标收集器单元测试
 */
@ExtendWith(MockitoExtension.class)
class CacheMetricsCollectorTest {

    @Mock
    private DurableTier durableTier;

    private SimpleMeterRegistry meterRegistry;
    private StatsCollector statsCollector;
    private CacheMetricsCollector metricsCollector;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        statsCollector = new StatsCollector(0.5, 20);
        metricsCollector = new CacheMetricsCollector(statsCollector, durableTier, meterRegistry);
    }

    @Test
    @DisplayName("统计数据暴露为 Micrometer 指标")
    void testGauges() {
        statsCollector.recordRequest();
        statsCollector.recordRequest();
        statsCollector.recordVolatileHit(0.10);
        statsCollector.recordVolatileMiss();
        statsCollector.recordMiss("discovery:abc", 0.10);

        assertEquals(2.0, meterRegistry.get("property.cache.requests").gauge().value());
        assertEquals(0.5, meterRegistry.get("property.cache.hit_rate").gauge().value(), 1e-9);
        assertEquals(0.10, meterRegistry.get("property.cache.cost_savings").gauge().value(), 1e-9);
        assertEquals(1.0, meterRegistry.get("property.cache.hits").tag("tier", "volatile").gauge().value());
        assertEquals(1.0, meterRegistry.get("property.cache.misses").tag("tier", "durable").gauge().value());
    }

    @Test
    @DisplayName("无流量时跳过报告")
    void testReportSkippedWithoutTraffic() {
        metricsCollector.logPerformanceReport();

        verifyNoInteractions(durableTier);
    }

    @Test
    @DisplayName("报告包含持久层汇总，持久层故障不影响报告")
    void testReportWithDurableSummary() {
        statsCollector.recordRequest();
        when(durableTier.summarize()).thenReturn(new DurableTierSummary(3, 9, 0.6));
        when(durableTier.name()).thenReturn("memory");

        assertDoesNotThrow(() -> metricsCollector.logPerformanceReport());
        verify(durableTier).summarize();

        when(durableTier.summarize()).thenThrow(new IllegalStateException("db down"));
        assertDoesNotThrow(() -> metricsCollector.logPerformanceReport());
    }
}
