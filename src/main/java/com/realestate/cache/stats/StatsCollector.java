package com.realestate.cache.stats;

import com.realestate.cache.config.CacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * 缓存统计收集器
 * 计数器全部原子递增，并发下结果精确；平均延迟采用增量均值 avg += (x - avg) / n
 */
@Component
public class StatsCollector {

    private static final Logger log = LoggerFactory.getLogger(StatsCollector.class);

    // 计数器
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong volatileHits = new AtomicLong(0);
    private final AtomicLong volatileMisses = new AtomicLong(0);
    private final AtomicLong durableHits = new AtomicLong(0);
    private final AtomicLong durableMisses = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);

    private final DoubleAdder costSavings = new DoubleAdder();

    // 均值与样本数需一起更新
    private final Object latencyLock = new Object();
    private long latencySamples;
    private double avgLatencyMillis;

    private final double hitRateFloor;
    private final long minSampleSize;

    @Autowired
    public StatsCollector(CacheProperties cacheProperties) {
        this(cacheProperties.getStats().getHitRateFloor(), cacheProperties.getStats().getMinSampleSize());
    }

    public StatsCollector(double hitRateFloor, long minSampleSize) {
        this.hitRateFloor = hitRateFloor;
        this.minSampleSize = minSampleSize;
    }

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordVolatileHit(double unitCost) {
        volatileHits.incrementAndGet();
        costSavings.add(unitCost);
    }

    public void recordVolatileMiss() {
        volatileMisses.incrementAndGet();
    }

    public void recordDurableHit(double unitCost) {
        durableHits.incrementAndGet();
        costSavings.add(unitCost);
    }

    /**
     * 两层均未命中
     */
    public void recordMiss(String key, double unitCost) {
        durableMisses.incrementAndGet();
        checkHitRate(key, unitCost);
    }

    public void recordWrite() {
        writes.incrementAndGet();
    }

    public void recordLatency(long durationNanos) {
        double sample = durationNanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
        synchronized (latencyLock) {
            latencySamples++;
            avgLatencyMillis += (sample - avgLatencyMillis) / latencySamples;
        }
    }

    /**
     * 命中率低于阈值时告警，仅用于观测，不影响控制流
     */
    private void checkHitRate(String key, double unitCost) {
        long requests = totalRequests.get();
        if (requests < minSampleSize) {
            return;
        }
        double hitRate = hitRate(requests);
        if (hitRate < hitRateFloor) {
            log.warn("Low cache hit rate {}% (floor {}%) after miss on {}, upstream call cost ~${}",
                String.format("%.1f", hitRate * 100), String.format("%.1f", hitRateFloor * 100),
                key, String.format("%.3f", unitCost));
        }
    }

    private double hitRate(long requests) {
        if (requests == 0) {
            return 0;
        }
        // 并发下快照可能略有错位，截断到 [0, 1]
        double rate = (double) (volatileHits.get() + durableHits.get()) / requests;
        return Math.min(1.0, Math.max(0.0, rate));
    }

    /**
     * 获取统计快照
     */
    public CacheStatsSnapshot getStats() {
        long requests = totalRequests.get();
        double latency;
        synchronized (latencyLock) {
            latency = avgLatencyMillis;
        }
        return new CacheStatsSnapshot(
            requests,
            hitRate(requests),
            latency,
            costSavings.sum(),
            writes.get(),
            new CacheStatsSnapshot.TierStats(volatileHits.get(), volatileMisses.get()),
            new CacheStatsSnapshot.TierStats(durableHits.get(), durableMisses.get())
        );
    }

    /**
     * 清零（运维手动重置）
     */
    public void reset() {
        totalRequests.set(0);
        volatileHits.set(0);
        volatileMisses.set(0);
        durableHits.set(0);
        durableMisses.set(0);
        writes.set(0);
        costSavings.reset();
        synchronized (latencyLock) {
            latencySamples = 0;
            avgLatencyMillis = 0;
        }
        log.info("Cache stats reset");
    }
}
