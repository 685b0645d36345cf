package com.realestate.cache.warmup;

/**
 * 单条预热结果状态
 */
public enum WarmupStatus {
    /** 回源并写入缓存 */
    WARMED,
    /** 已在缓存中 */
    ALREADY_CACHED,
    /** 未提供回源函数 */
    NO_FETCH_FUNCTION,
    /** 失败（参数非法、回源异常、写入失败、超时） */
    ERROR
}
