package com.realestate.cache.warmup;

import java.util.Map;

/**
 * @param params  原始请求参数
 * @param status  结果状态
 * @param message 失败原因，成功时为 null
 */
public record WarmupItemResult(Map<String, ?> params, WarmupStatus status, String message) {

    static WarmupItemResult of(Map<String, ?> params, WarmupStatus status) {
        return new WarmupItemResult(params, status, null);
    }

    static WarmupItemResult error(Map<String, ?> params, String message) {
        return new WarmupItemResult(params, WarmupStatus.ERROR, message);
    }
}
