package com.realestate.cache.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 持久层缓存条目
 */
@Data
@Entity
@Table(name = "property_cache_entry", indexes = {
    @Index(name = "idx_cache_type", columnList = "cache_type"),
    @Index(name = "idx_expires_at", columnList = "expires_at"),
    @Index(name = "idx_last_accessed", columnList = "last_accessed_at")
})
public class CacheRecordEntity {

    /** 渲染后的缓存 Key */
    @Id
    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    /** 数据类别 */
    @Column(name = "cache_type", nullable = false, length = 64)
    private String cacheType;

    /** 规范化参数（规范 JSON，用于碰撞校验） */
    @Lob
    @Column(name = "params_json", nullable = false)
    private String paramsJson;

    /** 缓存数据 JSON */
    @Lob
    @Column(name = "payload_json", nullable = false)
    private String payloadJson;

    /** 元数据 JSON */
    @Lob
    @Column(name = "metadata_json")
    private String metadataJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    /** 访问次数，创建时为 1 */
    @Column(name = "access_count", nullable = false)
    private long accessCount;

    /** 单次上游调用估算成本 */
    @Column(name = "estimated_unit_cost", nullable = false)
    private double estimatedUnitCost;

    /** 累计节省成本 */
    @Column(name = "cost_saved", nullable = false)
    private double costSaved;
}
