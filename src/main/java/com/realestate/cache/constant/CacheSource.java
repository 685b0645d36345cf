package com.realestate.cache.constant;

/**
 * 读取命中的缓存层
 */
public enum CacheSource {
    /** 易失层（Redis / 本地） */
    VOLATILE,
    /** 持久层 */
    DURABLE,
    /** 未命中 */
    NONE
}
