package com.realestate.cache.exception;

/**
 * 缓存层 I/O 故障基类
 * 由 TierManager 吸收并降级为未命中 / 跳过写入，不会传播给调用方
 */
public abstract class CacheTierException extends RuntimeException {

    protected CacheTierException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 故障所在层级名称，用于日志
     */
    public abstract String tier();
}
