package com.realestate.cache.policy;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 数据类别 TTL 策略表
 * 每个类别：易失层 TTL、持久层 TTL、是否落持久层、单次上游调用估算成本（美元）
 */
public enum CacheDataClass {

    // ==================== 搜索结果 ====================

    /** 房源发现搜索：聚合结果每天变化 */
    DISCOVERY("discovery", Duration.ofHours(6), Duration.ofHours(24), true, 0.10),

    /** 市场列表发现：挂牌状态变化快 */
    MARKETPLACE_DISCOVERY("marketplace_discovery", Duration.ofHours(2), Duration.ofHours(2), true, 0.10),

    /** 已核验地址：几乎不变 */
    ADDRESS("address", Duration.ofHours(6), Duration.ofDays(30), true, 0.05),

    /** 房源详情快照 */
    DETAILS("details", Duration.ofHours(6), Duration.ofDays(30), true, 0.15),

    // ==================== 第三方 API 响应 ====================

    ZILLOW_SEARCH("zillow_search", Duration.ofHours(6), Duration.ofHours(24), false, 0.02),

    /** 图集很少变化 */
    ZILLOW_IMAGES("zillow_images", Duration.ofHours(6), Duration.ofDays(7), false, 0.01),

    /** 房产情报按天更新 */
    CORELOGIC("corelogic", Duration.ofHours(6), Duration.ofHours(24), false, 0.50),

    // ==================== 房源详情 ====================

    PROPERTY_BASIC("property_basic", Duration.ofHours(6), Duration.ofHours(24), false, 0.01),

    PROPERTY_DETAILED("property_detailed", Duration.ofHours(6), Duration.ofHours(24), false, 0.01),

    /** 综合情报报告，单次成本最高 */
    PROPERTY_INTELLIGENCE("property_intelligence", Duration.ofHours(6), Duration.ofDays(7), false, 2.00),

    ADDRESS_VERIFICATION("address_verification", Duration.ofHours(6), Duration.ofDays(30), false, 0.05),

    // ==================== 用户维度 ====================

    /** 最近搜索历史：短期有效 */
    USER_SEARCH_HISTORY("user_search_history", Duration.ofHours(2), Duration.ofHours(2), false, 0.01),

    USER_PREFERENCES("user_preferences", Duration.ofHours(6), Duration.ofHours(24), false, 0.01),

    // ==================== 系统数据 ====================

    /** 第三方 token 在过期前刷新 */
    API_TOKENS("api_tokens", Duration.ofMinutes(50), Duration.ofMinutes(50), false, 0.01),

    RATE_LIMITS("rate_limits", Duration.ofHours(2), Duration.ofHours(2), false, 0.01);

    private static final Map<String, CacheDataClass> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CacheDataClass::typeName, Function.identity()));

    private final String typeName;
    private final Duration volatileTtl;
    private final Duration durableTtl;
    private final boolean durableEligible;
    private final double estimatedUnitCost;

    CacheDataClass(String typeName, Duration volatileTtl, Duration durableTtl,
                   boolean durableEligible, double estimatedUnitCost) {
        this.typeName = typeName;
        this.volatileTtl = volatileTtl;
        this.durableTtl = durableTtl;
        this.durableEligible = durableEligible;
        this.estimatedUnitCost = estimatedUnitCost;
    }

    public static Optional<CacheDataClass> of(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(type.trim().toLowerCase(Locale.ROOT)));
    }

    public String typeName() {
        return typeName;
    }

    public Duration volatileTtl() {
        return volatileTtl;
    }

    public Duration durableTtl() {
        return durableTtl;
    }

    public boolean durableEligible() {
        return durableEligible;
    }

    public double estimatedUnitCost() {
        return estimatedUnitCost;
    }
}
