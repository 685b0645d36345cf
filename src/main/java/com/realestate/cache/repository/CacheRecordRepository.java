package com.realestate.cache.repository;

import com.realestate.cache.entity.CacheRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * 持久层缓存 Repository
 */
@Repository
public interface CacheRecordRepository extends JpaRepository<CacheRecordEntity, String> {

    /**
     * 原子更新访问统计
     * cost_saved 先按旧的 access_count 计算，等于 unitCost * (新 accessCount - 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CacheRecordEntity r SET r.costSaved = r.estimatedUnitCost * r.accessCount, "
        + "r.accessCount = r.accessCount + 1, r.lastAccessedAt = :now WHERE r.cacheKey = :key")
    int touch(@Param("key") String key, @Param("now") Instant now);

    /**
     * 查询全部 Key（模式失效在应用侧匹配）
     */
    @Query("SELECT r.cacheKey FROM CacheRecordEntity r")
    List<String> findAllKeys();

    @Query("SELECT COALESCE(SUM(r.accessCount), 0) FROM CacheRecordEntity r")
    Long sumAccessCount();

    @Query("SELECT COALESCE(SUM(r.costSaved), 0) FROM CacheRecordEntity r")
    Double sumCostSaved();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CacheRecordEntity r WHERE r.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CacheRecordEntity r WHERE r.lastAccessedAt < :cutoff AND r.accessCount < :minAccessCount")
    int deleteStale(@Param("cutoff") Instant cutoff, @Param("minAccessCount") long minAccessCount);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CacheRecordEntity r WHERE r.cacheKey IN :keys")
    int deleteByKeys(@Param("keys") List<String> keys);
}
