package com.realestate.cache.tier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.realestate.cache.entity.CacheRecordEntity;
import com.realestate.cache.exception.DurableTierException;
import com.realestate.cache.repository.CacheRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 基于 JPA 的持久层
 *
 * 过期语义：读取时过滤 expires_at，物理删除由 DurableTierJanitor 定期执行。
 * 模式删除需要把全部 Key 拉到应用侧匹配，数据量大时代价较高。
 */
public class JpaDurableTier implements DurableTier {

    private static final Logger log = LoggerFactory.getLogger(JpaDurableTier.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // 批量删除时每批 Key 数量
    private static final int DELETE_BATCH_SIZE = 500;

    private final CacheRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaDurableTier(CacheRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        // 参数按 Key 排序序列化，保证碰撞校验时文本可直接比较
        this.objectMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    @Override
    public String name() {
        return "jpa";
    }

    @Override
    @Transactional
    public Optional<DurableRecord> findByParams(String key, Map<String, Object> normalizedParams) {
        Optional<CacheRecordEntity> found = repository.findById(key);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CacheRecordEntity entity = found.get();
        Instant now = clock.instant();
        if (!entity.getExpiresAt().isAfter(now)) {
            log.debug("Durable entry expired: {}", key);
            return Optional.empty();
        }
        if (!writeJson(normalizedParams).equals(entity.getParamsJson())) {
            log.warn("Durable key {} holds different params, treating as miss (hash collision)", key);
            return Optional.empty();
        }

        // 以库内原子更新为准，返回值按本次读取推算
        repository.touch(key, now);
        long count = entity.getAccessCount() + 1;
        return Optional.of(toRecord(entity, now, count,
            DurableRecord.costSaved(entity.getEstimatedUnitCost(), count)));
    }

    @Override
    @Transactional
    public DurableRecord upsert(DurableWrite write) {
        Instant now = clock.instant();
        CacheRecordEntity entity = repository.findById(write.key())
            .filter(existing -> existing.getExpiresAt().isAfter(now))
            .map(existing -> {
                existing.setAccessCount(existing.getAccessCount() + 1);
                return existing;
            })
            .orElseGet(() -> {
                CacheRecordEntity created = new CacheRecordEntity();
                created.setCacheKey(write.key());
                created.setCreatedAt(now);
                created.setAccessCount(1);
                return created;
            });

        entity.setCacheType(write.type());
        entity.setParamsJson(writeJson(write.normalizedParams()));
        entity.setPayloadJson(write.payloadJson());
        entity.setMetadataJson(writeJson(write.metadata()));
        entity.setLastAccessedAt(now);
        entity.setExpiresAt(now.plusSeconds(write.ttlSeconds()));
        entity.setEstimatedUnitCost(write.estimatedUnitCost());
        entity.setCostSaved(DurableRecord.costSaved(write.estimatedUnitCost(), entity.getAccessCount()));

        CacheRecordEntity saved = repository.save(entity);
        return toRecord(saved, saved.getLastAccessedAt(), saved.getAccessCount(), saved.getCostSaved());
    }

    @Override
    @Transactional
    public int deleteMatching(Pattern pattern) {
        List<String> matched = repository.findAllKeys().stream()
            .filter(key -> pattern.matcher(key).find())
            .toList();
        int deleted = 0;
        for (int i = 0; i < matched.size(); i += DELETE_BATCH_SIZE) {
            deleted += repository.deleteByKeys(matched.subList(i, Math.min(i + DELETE_BATCH_SIZE, matched.size())));
        }
        return deleted;
    }

    @Override
    @Transactional
    public boolean delete(String key) {
        return repository.deleteByKeys(List.of(key)) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public DurableTierSummary summarize() {
        Long accesses = repository.sumAccessCount();
        Double saved = repository.sumCostSaved();
        return new DurableTierSummary(repository.count(),
            accesses != null ? accesses : 0L,
            saved != null ? saved : 0.0);
    }

    @Override
    @Transactional
    public int purgeExpired() {
        return repository.deleteExpired(clock.instant());
    }

    @Override
    @Transactional
    public int purgeStale(Duration idleFor, int minAccessCount) {
        return repository.deleteStale(clock.instant().minus(idleFor), minAccessCount);
    }

    private DurableRecord toRecord(CacheRecordEntity entity, Instant lastAccessedAt, long accessCount, double costSaved) {
        return new DurableRecord(
            entity.getCacheKey(),
            entity.getCacheType(),
            readJson(entity.getParamsJson()),
            entity.getPayloadJson(),
            entity.getCreatedAt(),
            lastAccessedAt,
            entity.getExpiresAt(),
            accessCount,
            entity.getEstimatedUnitCost(),
            costSaved,
            entity.getMetadataJson() != null ? readJson(entity.getMetadataJson()) : Map.of()
        );
    }

    private String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Map.of());
        } catch (JsonProcessingException e) {
            throw new DurableTierException("Durable record serialization failed", e);
        }
    }

    private Map<String, Object> readJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DurableTierException("Durable record deserialization failed", e);
        }
    }
}
