package com.realestate.cache.tier;

/**
 * 易失层契约：低延迟、尽力持久（重启可能丢失）
 * 值为 JSON 文本；实现类在 I/O 故障时抛出 VolatileTierException
 */
public interface VolatileTier {

    /**
     * 层名称，用于日志与监控
     */
    String name();

    /**
     * @return 缓存值，未命中返回 null
     */
    String get(String key);

    void set(String key, String value, long ttlSeconds);

    void delete(String key);
}
