package com.realestate.cache.health;

import com.realestate.cache.service.TierResilienceGuard;
import com.realestate.cache.stats.CacheStatsSnapshot;
import com.realestate.cache.stats.StatsCollector;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.DurableTierSummary;
import com.realestate.cache.tier.VolatileTier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 缓存引擎健康检查
 * 熔断打开视为 DOWN：缓存仍可降级工作，但所有请求都会打到上游
 */
@Component("cacheHealthIndicator")
public class CacheHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(CacheHealthIndicator.class);

    private final VolatileTier volatileTier;
    private final DurableTier durableTier;
    private final TierResilienceGuard resilienceGuard;
    private final StatsCollector statsCollector;

    public CacheHealthIndicator(VolatileTier volatileTier,
                                DurableTier durableTier,
                                TierResilienceGuard resilienceGuard,
                                StatsCollector statsCollector) {
        this.volatileTier = volatileTier;
        this.durableTier = durableTier;
        this.resilienceGuard = resilienceGuard;
        this.statsCollector = statsCollector;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allHealthy = true;

        // 1. 熔断器状态
        CircuitBreaker.State volatileState = resilienceGuard.volatileState();
        CircuitBreaker.State durableState = resilienceGuard.durableState();
        details.put("volatile_tier", volatileTier.name());
        details.put("volatile_circuit", volatileState.name());
        details.put("durable_tier", durableTier.name());
        details.put("durable_circuit", durableState.name());
        if (isOpen(volatileState) || isOpen(durableState)) {
            allHealthy = false;
        }

        // 2. 持久层连通性
        try {
            DurableTierSummary summary = durableTier.summarize();
            details.put("durable_entries", summary.totalEntries());
            details.put("durable_cost_saved", summary.totalCostSaved());
        } catch (RuntimeException e) {
            log.error("Durable tier health check failed", e);
            details.put("durable_error", e.getMessage());
            allHealthy = false;
        }

        // 3. 统计
        CacheStatsSnapshot stats = statsCollector.getStats();
        details.put("total_requests", stats.totalRequests());
        details.put("hit_rate", stats.hitRate());
        details.put("cost_savings", stats.costSavings());

        if (allHealthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }

    private static boolean isOpen(CircuitBreaker.State state) {
        return state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
    }
}
