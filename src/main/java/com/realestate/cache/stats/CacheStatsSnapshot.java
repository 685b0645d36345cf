package com.realestate.cache.stats;

/**
 * 统计快照，字段结构稳定，供外部看板周期拉取
 *
 * @param totalRequests    get 请求总数
 * @param hitRate          (volatileHits + durableHits) / totalRequests，范围 [0, 1]
 * @param avgLatencyMillis get 平均耗时（毫秒）
 * @param costSavings      命中累计节省的上游调用成本
 * @param writes           写入次数
 * @param volatileTier     易失层命中明细
 * @param durableTier      持久层命中明细
 */
public record CacheStatsSnapshot(
    long totalRequests,
    double hitRate,
    double avgLatencyMillis,
    double costSavings,
    long writes,
    TierStats volatileTier,
    TierStats durableTier
) {

    public long totalHits() {
        return volatileTier.hits() + durableTier.hits();
    }

    /**
     * 单层命中统计
     */
    public record TierStats(long hits, long misses) {

        public double hitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0;
        }
    }
}
