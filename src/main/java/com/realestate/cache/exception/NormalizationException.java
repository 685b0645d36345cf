package com.realestate.cache.exception;

/**
 * 请求描述符不合法（类型为空、参数无法规范化、失效模式非法等）
 * 引擎中唯一会抛给调用方的异常
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
