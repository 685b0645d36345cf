package com.realestate.cache.dto;

import com.realestate.cache.constant.CachePriority;
import com.realestate.cache.key.KeyOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 缓存读写选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheOptions {

    /** Key 前缀，null 使用全局配置 */
    private String prefix;

    /** 是否按用户隔离 */
    private boolean userSpecific;

    /** 用户 ID */
    private String userId;

    /** 是否附加小时时间桶 */
    private boolean includeTimestamp;

    /** 指定 TTL（秒），null 使用策略表；易失层仍受上限约束 */
    private Long ttlSeconds;

    /** 写入优先级 */
    @Builder.Default
    private CachePriority priority = CachePriority.NORMAL;

    /** 覆盖策略表中的单次调用成本 */
    private Double estimatedCost;

    /** 调用方附加元数据 */
    private Map<String, Object> metadata;

    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }

    public KeyOptions toKeyOptions() {
        return new KeyOptions(prefix, userSpecific, userId, includeTimestamp);
    }
}
