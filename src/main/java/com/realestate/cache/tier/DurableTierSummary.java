package com.realestate.cache.tier;

/**
 * 持久层聚合统计
 */
public record DurableTierSummary(long totalEntries, long totalAccesses, double totalCostSaved) {

    public double avgAccesses() {
        return totalEntries > 0 ? (double) totalAccesses / totalEntries : 0;
    }
}
