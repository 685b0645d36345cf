package com.realestate.cache.tier;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 持久层契约：持久、较慢、可查询
 * 实现类为同步阻塞调用，超时与熔断由 TierManager 统一处理
 */
public interface DurableTier {

    String name();

    /**
     * 按 Key 查询，并校验存储的完整规范化参数与请求一致（拦截截断哈希碰撞）。
     * 命中时更新访问统计：accessCount + 1、lastAccessedAt、cumulativeCostSaved。
     *
     * @return 未命中、已过期或参数不一致时返回 empty
     */
    Optional<DurableRecord> findByParams(String key, Map<String, Object> normalizedParams);

    /**
     * 写入或覆盖（last-writer-wins）
     */
    DurableRecord upsert(DurableWrite write);

    /**
     * 删除 Key 匹配正则（find 语义）的条目
     *
     * @return 删除条数
     */
    int deleteMatching(Pattern pattern);

    boolean delete(String key);

    DurableTierSummary summarize();

    /**
     * 物理删除已过期条目
     */
    int purgeExpired();

    /**
     * 删除长时间未访问且访问次数低的冷条目
     */
    int purgeStale(Duration idleFor, int minAccessCount);
}
