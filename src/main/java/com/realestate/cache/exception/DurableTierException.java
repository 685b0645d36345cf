package com.realestate.cache.exception;

/**
 * 持久层故障（连接异常、查询超时）
 */
public class DurableTierException extends CacheTierException {

    public DurableTierException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String tier() {
        return "durable";
    }
}
