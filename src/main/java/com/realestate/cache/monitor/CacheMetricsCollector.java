package com.realestate.cache.monitor;

import com.realestate.cache.stats.CacheStatsSnapshot;
import com.realestate.cache.stats.StatsCollector;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.DurableTierSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 缓存监控指标收集器
 * 将 StatsCollector 的计数暴露为 Micrometer 指标，并定时输出性能报告
 */
@Component
public class CacheMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(CacheMetricsCollector.class);

    private final StatsCollector statsCollector;
    private final DurableTier durableTier;

    public CacheMetricsCollector(StatsCollector statsCollector, DurableTier durableTier, MeterRegistry meterRegistry) {
        this.statsCollector = statsCollector;
        this.durableTier = durableTier;
        registerMetrics(meterRegistry);
    }

    private void registerMetrics(MeterRegistry meterRegistry) {
        Gauge.builder("property.cache.requests", statsCollector, s -> s.getStats().totalRequests())
            .description("Total cache lookups")
            .register(meterRegistry);
        Gauge.builder("property.cache.hit_rate", statsCollector, s -> s.getStats().hitRate())
            .description("Overall hit rate across tiers")
            .register(meterRegistry);
        Gauge.builder("property.cache.cost_savings", statsCollector, s -> s.getStats().costSavings())
            .description("Estimated upstream cost saved by cache hits (USD)")
            .register(meterRegistry);
        Gauge.builder("property.cache.avg_latency_ms", statsCollector, s -> s.getStats().avgLatencyMillis())
            .register(meterRegistry);
        Gauge.builder("property.cache.writes", statsCollector, s -> s.getStats().writes())
            .register(meterRegistry);

        // 分层命中 / 未命中
        Gauge.builder("property.cache.hits", statsCollector, s -> s.getStats().volatileTier().hits())
            .tag("tier", "volatile")
            .register(meterRegistry);
        Gauge.builder("property.cache.hits", statsCollector, s -> s.getStats().durableTier().hits())
            .tag("tier", "durable")
            .register(meterRegistry);
        Gauge.builder("property.cache.misses", statsCollector, s -> s.getStats().volatileTier().misses())
            .tag("tier", "volatile")
            .register(meterRegistry);
        Gauge.builder("property.cache.misses", statsCollector, s -> s.getStats().durableTier().misses())
            .tag("tier", "durable")
            .register(meterRegistry);
    }

    /**
     * 定时打印缓存性能报告
     */
    @Scheduled(fixedRateString = "${property-cache.stats.report-interval-ms:60000}",
        initialDelayString = "${property-cache.stats.report-interval-ms:60000}")
    public void logPerformanceReport() {
        CacheStatsSnapshot stats = statsCollector.getStats();
        if (stats.totalRequests() == 0 && stats.writes() == 0) {
            log.debug("Cache performance report skipped, no traffic yet");
            return;
        }
        log.info("Cache performance: requests={}, hitRate={}%, volatileHits={}, durableHits={}, misses={}, "
                + "writes={}, avgLatency={}ms, costSavings=${}",
            stats.totalRequests(),
            String.format("%.1f", stats.hitRate() * 100),
            stats.volatileTier().hits(),
            stats.durableTier().hits(),
            stats.durableTier().misses(),
            stats.writes(),
            String.format("%.2f", stats.avgLatencyMillis()),
            String.format("%.2f", stats.costSavings()));

        try {
            DurableTierSummary summary = durableTier.summarize();
            log.info("Durable tier ({}): entries={}, totalAccesses={}, avgAccesses={}, costSaved=${}",
                durableTier.name(), summary.totalEntries(), summary.totalAccesses(),
                String.format("%.1f", summary.avgAccesses()), String.format("%.2f", summary.totalCostSaved()));
        } catch (RuntimeException e) {
            log.warn("Durable tier summary unavailable: {}", e.getMessage());
        }
    }
}
