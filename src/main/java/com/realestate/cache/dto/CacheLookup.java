package com.realestate.cache.dto;

import com.realestate.cache.constant.CacheSource;

/**
 * 缓存读取结果
 *
 * @param data          命中的数据，未命中为 null
 * @param source        命中层
 * @param cached        是否命中
 * @param warmed        持久层命中后是否成功回填易失层
 * @param key           缓存 Key
 * @param elapsedMillis 耗时（毫秒）
 */
public record CacheLookup<T>(T data, CacheSource source, boolean cached, boolean warmed,
                             String key, double elapsedMillis) {

    public static <T> CacheLookup<T> miss(String key, double elapsedMillis) {
        return new CacheLookup<>(null, CacheSource.NONE, false, false, key, elapsedMillis);
    }
}
