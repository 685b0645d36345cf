package com.realestate.cache.exception;

/**
 * 易失层故障（连接异常、反序列化失败）
 */
public class VolatileTierException extends CacheTierException {

    public VolatileTierException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String tier() {
        return "volatile";
    }
}
