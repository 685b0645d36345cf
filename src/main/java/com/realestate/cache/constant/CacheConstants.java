package com.realestate.cache.constant;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== Key 结构 ====================

    /** Key 片段分隔符 */
    public static final String KEY_SEPARATOR = ":";

    /** 用户维度标签 */
    public static final String USER_TAG = "user";

    /** 小时时间桶标签 */
    public static final String TIME_BUCKET_TAG = "t";

    /** 默认哈希截断长度（十六进制字符数） */
    public static final int DEFAULT_HASH_LENGTH = 8;

    /** 时间桶粒度（毫秒） */
    public static final long HOUR_BUCKET_MILLIS = 60L * 60 * 1000;

    // ==================== TTL ====================

    /** 易失层 TTL 上限（秒），易失层只存热数据 */
    public static final long VOLATILE_TTL_CEILING_SECONDS = 6L * 60 * 60;

    /** 未登记数据类别的默认 TTL（秒） */
    public static final long DEFAULT_TTL_SECONDS = 60L * 60;

    /** 未登记数据类别的默认单次调用成本（美元） */
    public static final double DEFAULT_UNIT_COST = 0.01;

    // ==================== 持久层 ====================

    /** 持久层查询超时（毫秒） */
    public static final long DURABLE_QUERY_TIMEOUT_MS = 5000;

    // ==================== 元数据字段 ====================

    public static final String META_CACHE_TYPE = "cacheType";
    public static final String META_PRIORITY = "priority";
    public static final String META_ESTIMATED_COST = "estimatedCost";
    public static final String META_DATA_SIZE = "dataSize";
    public static final String META_TIMESTAMP = "timestamp";
    public static final String META_TTL = "ttl";
    public static final String META_WARMED = "warmed";

    // ==================== 统计 ====================

    /** 命中率告警阈值 */
    public static final double DEFAULT_HIT_RATE_FLOOR = 0.5;

    // ==================== 预热 ====================

    /** 预热默认批大小 */
    public static final int DEFAULT_WARM_BATCH_SIZE = 5;

    /** 批间延迟（毫秒），保护上游限流 */
    public static final long DEFAULT_WARM_BATCH_DELAY_MS = 500;
}
