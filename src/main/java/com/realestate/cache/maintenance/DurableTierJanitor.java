package com.realestate.cache.maintenance;

import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.tier.DurableTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 持久层清理任务
 * 1. 物理删除已过期条目（读路径已过滤，这里只回收空间）
 * 2. 删除长期未访问且访问次数低的冷条目
 */
@Component
@ConditionalOnProperty(prefix = "property-cache.durable-tier.janitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DurableTierJanitor {

    private static final Logger log = LoggerFactory.getLogger(DurableTierJanitor.class);

    private final DurableTier durableTier;
    private final CacheProperties.JanitorConfig config;

    public DurableTierJanitor(DurableTier durableTier, CacheProperties cacheProperties) {
        this.durableTier = durableTier;
        this.config = cacheProperties.getDurableTier().getJanitor();
    }

    @Scheduled(fixedDelayString = "${property-cache.durable-tier.janitor.interval-ms:600000}",
        initialDelayString = "${property-cache.durable-tier.janitor.interval-ms:600000}")
    public void scheduledCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.warn("Durable tier cleanup failed, will retry next round: {}", e.getMessage());
        }
    }

    /**
     * @return 本轮删除总条数
     */
    public int cleanup() {
        int expired = durableTier.purgeExpired();
        int stale = durableTier.purgeStale(config.getStaleAfter(), config.getMinAccessCount());
        if (expired > 0 || stale > 0) {
            log.info("Durable tier cleanup: expired={}, stale={} (idle > {}, accessCount < {})",
                expired, stale, config.getStaleAfter(), config.getMinAccessCount());
        } else {
            log.debug("Durable tier cleanup: nothing to remove");
        }
        return expired + stale;
    }
}
