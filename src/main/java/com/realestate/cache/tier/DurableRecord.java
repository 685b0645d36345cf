package com.realestate.cache.tier;

import java.time.Instant;
import java.util.Map;

/**
 * 持久层条目
 * cumulativeCostSaved = estimatedUnitCost * (accessCount - 1)
 */
public record DurableRecord(String key,
                            String type,
                            Map<String, Object> normalizedParams,
                            String payloadJson,
                            Instant createdAt,
                            Instant lastAccessedAt,
                            Instant expiresAt,
                            long accessCount,
                            double estimatedUnitCost,
                            double cumulativeCostSaved,
                            Map<String, Object> metadata) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public static double costSaved(double unitCost, long accessCount) {
        return unitCost * Math.max(0, accessCount - 1);
    }
}
