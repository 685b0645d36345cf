package com.realestate.cache.key;

import java.util.Map;

/**
 * KeyNormalizer 的输出
 *
 * @param key              渲染后的 Key 字符串
 * @param cacheKey         结构化 Key
 * @param normalizedParams 规范化后的参数（按 Key 排序，不可变）
 * @param canonicalParams  规范化参数的确定性 JSON 序列化结果
 */
public record GeneratedKey(String key,
                           CacheKey cacheKey,
                           Map<String, Object> normalizedParams,
                           String canonicalParams) {

    public String type() {
        return cacheKey.type();
    }

    public String hash() {
        return cacheKey.hash();
    }
}
