package com.realestate.cache.exception;

/**
 * 上游数据源拉取失败
 * 仅由 getOrFetch 的回源函数产生，错误归调用方处理
 */
public class UpstreamFetchException extends RuntimeException {

    private final String cacheKey;

    public UpstreamFetchException(String cacheKey, Throwable cause) {
        super("Upstream fetch failed for key " + cacheKey, cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
