package com.realestate.cache.config;

import com.realestate.cache.constant.CacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 缓存引擎配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "property-cache")
public class CacheProperties {

    /** 易失层配置 */
    private VolatileTierConfig volatileTier = new VolatileTierConfig();

    /** 持久层配置 */
    private DurableTierConfig durableTier = new DurableTierConfig();

    /** Key 生成配置 */
    private KeyConfig key = new KeyConfig();

    /** 统计配置 */
    private StatsConfig stats = new StatsConfig();

    /** 预热配置 */
    private WarmerConfig warmer = new WarmerConfig();

    /** I/O 线程池配置 */
    private IoConfig io = new IoConfig();

    @Data
    public static class VolatileTierConfig {
        /** redis | local */
        private String mode = "redis";
        /** 易失层 TTL 硬上限 */
        private Duration ceiling = Duration.ofSeconds(CacheConstants.VOLATILE_TTL_CEILING_SECONDS);
        /** local 模式下最大条目数 */
        private long maximumSize = 10_000;
    }

    @Data
    public static class DurableTierConfig {
        /** jpa | memory */
        private String mode = "jpa";
        /** 查询超时，超时按未命中处理 */
        private Duration queryTimeout = Duration.ofMillis(CacheConstants.DURABLE_QUERY_TIMEOUT_MS);
        /** 过期 / 冷数据清理 */
        private JanitorConfig janitor = new JanitorConfig();
    }

    @Data
    public static class JanitorConfig {
        private boolean enabled = true;
        /** 清理间隔（毫秒） */
        private long intervalMs = 10 * 60 * 1000;
        /** 超过该时长未访问视为冷数据 */
        private Duration staleAfter = Duration.ofDays(7);
        /** 访问次数低于该值的冷数据才会被清理 */
        private int minAccessCount = 2;
    }

    @Data
    public static class KeyConfig {
        /** 全局 Key 前缀，为空则不加 */
        private String prefix = "";
        /** 哈希截断长度 */
        private int hashLength = CacheConstants.DEFAULT_HASH_LENGTH;
    }

    @Data
    public static class StatsConfig {
        /** 命中率低于该值时打印告警 */
        private double hitRateFloor = CacheConstants.DEFAULT_HIT_RATE_FLOOR;
        /** 样本数达到该值后才判断命中率 */
        private long minSampleSize = 20;
        /** 性能报告间隔（毫秒） */
        private long reportIntervalMs = 60_000;
    }

    @Data
    public static class WarmerConfig {
        private int batchSize = CacheConstants.DEFAULT_WARM_BATCH_SIZE;
        private Duration batchDelay = Duration.ofMillis(CacheConstants.DEFAULT_WARM_BATCH_DELAY_MS);
        /** 单条预热超时 */
        private Duration itemTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class IoConfig {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 1000;
    }
}
