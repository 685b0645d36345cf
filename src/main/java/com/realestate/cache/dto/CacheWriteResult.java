package com.realestate.cache.dto;

/**
 * 缓存写入结果，层故障体现在 stored 标志上而不抛出
 */
public record CacheWriteResult(String key,
                               boolean volatileStored,
                               boolean durableStored,
                               long volatileTtlSeconds,
                               long durableTtlSeconds,
                               double elapsedMillis) {
}
