package com.realestate.cache.tier;

import java.util.Map;

/**
 * 持久层写入请求
 */
public record DurableWrite(String key,
                           String type,
                           Map<String, Object> normalizedParams,
                           String payloadJson,
                           long ttlSeconds,
                           double estimatedUnitCost,
                           Map<String, Object> metadata) {
}
