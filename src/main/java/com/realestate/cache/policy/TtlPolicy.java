package com.realestate.cache.policy;

import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.constant.CacheConstants;
import com.realestate.cache.exception.NormalizationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * TTL 策略
 * 静态策略表 + 易失层硬上限（默认 6h，易失层只承载热数据）
 */
@Component
public class TtlPolicy {

    private final long volatileCeilingSeconds;

    @Autowired
    public TtlPolicy(CacheProperties cacheProperties) {
        this(cacheProperties.getVolatileTier().getCeiling());
    }

    public TtlPolicy(Duration volatileCeiling) {
        if (volatileCeiling == null || volatileCeiling.isNegative() || volatileCeiling.isZero()) {
            throw new IllegalArgumentException("Volatile TTL ceiling must be positive: " + volatileCeiling);
        }
        this.volatileCeilingSeconds = volatileCeiling.toSeconds();
        for (CacheDataClass dataClass : CacheDataClass.values()) {
            // 持久层副本必须比易失层影子活得久
            if (dataClass.durableTtl().toSeconds() < effectiveVolatile(dataClass.volatileTtl().toSeconds())) {
                throw new IllegalStateException("Durable TTL shorter than volatile TTL for " + dataClass.typeName());
            }
        }
    }

    /**
     * 解析数据类别策略，未登记的类别使用默认行（1h / 1h，不落持久层）
     */
    public TtlRule ruleFor(String type) {
        return CacheDataClass.of(type)
            .map(dataClass -> new TtlRule(
                dataClass.typeName(),
                effectiveVolatile(dataClass.volatileTtl().toSeconds()),
                dataClass.durableTtl().toSeconds(),
                dataClass.durableEligible(),
                dataClass.estimatedUnitCost()))
            .orElseGet(() -> new TtlRule(
                type,
                effectiveVolatile(CacheConstants.DEFAULT_TTL_SECONDS),
                CacheConstants.DEFAULT_TTL_SECONDS,
                false,
                CacheConstants.DEFAULT_UNIT_COST));
    }

    /**
     * 计算易失层 TTL：min(requested ?? policy, ceiling)
     */
    public long volatileTtlSeconds(String type, Long requestedSeconds) {
        requirePositive(requestedSeconds);
        long base = requestedSeconds != null ? requestedSeconds : ruleFor(type).volatileSeconds();
        return effectiveVolatile(base);
    }

    /**
     * 计算持久层 TTL：requested ?? policy
     */
    public long durableTtlSeconds(String type, Long requestedSeconds) {
        requirePositive(requestedSeconds);
        return requestedSeconds != null ? requestedSeconds : ruleFor(type).durableSeconds();
    }

    /**
     * 调用方指定的 TTL 必须为正，0 或负数视为非法输入
     *
     * @throws NormalizationException TTL 非正
     */
    public static void requirePositive(Long requestedSeconds) {
        if (requestedSeconds != null && requestedSeconds <= 0) {
            throw new NormalizationException("Requested TTL must be positive: " + requestedSeconds);
        }
    }

    public long volatileCeilingSeconds() {
        return volatileCeilingSeconds;
    }

    private long effectiveVolatile(long seconds) {
        return Math.min(seconds, volatileCeilingSeconds);
    }
}
