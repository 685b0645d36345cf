package com.realestate.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.constant.CacheConstants;
import com.realestate.cache.constant.CachePriority;
import com.realestate.cache.constant.CacheSource;
import com.realestate.cache.dto.CacheEviction;
import com.realestate.cache.dto.CacheLookup;
import com.realestate.cache.dto.CacheOptions;
import com.realestate.cache.dto.CacheWriteResult;
import com.realestate.cache.exception.UpstreamFetchException;
import com.realestate.cache.key.GeneratedKey;
import com.realestate.cache.key.KeyNormalizer;
import com.realestate.cache.key.KeyOptions;
import com.realestate.cache.policy.TtlPolicy;
import com.realestate.cache.policy.TtlRule;
import com.realestate.cache.stats.StatsCollector;
import com.realestate.cache.tier.DurableRecord;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.DurableWrite;
import com.realestate.cache.tier.VolatileTier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 多级缓存门面
 * 易失层 → 持久层，持久层命中后回填易失层
 *
 * 故障处理：
 * 1. 参数规范化失败或指定 TTL 非正（NormalizationException）同步抛给调用方
 * 2. 层故障（连接、超时、熔断、反序列化）记 WARN 日志，读按未命中、写按跳过处理
 * 3. 易失层数据损坏时删除该条目并继续查询持久层
 */
@Service
public class TierManager {

    private static final Logger log = LoggerFactory.getLogger(TierManager.class);

    private final KeyNormalizer keyNormalizer;
    private final TtlPolicy ttlPolicy;
    private final StatsCollector statsCollector;
    private final VolatileTier volatileTier;
    private final DurableTier durableTier;
    private final TierResilienceGuard resilienceGuard;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;
    private final Duration durableTimeout;
    private final Clock clock;

    // 冷 Key 回源去重，完成后移除
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlightFetches = new ConcurrentHashMap<>();

    // 性能指标
    private final Map<CacheSource, Timer> lookupTimers = new EnumMap<>(CacheSource.class);
    private final Timer writeTimer;

    @Autowired
    public TierManager(KeyNormalizer keyNormalizer,
                       TtlPolicy ttlPolicy,
                       StatsCollector statsCollector,
                       VolatileTier volatileTier,
                       DurableTier durableTier,
                       TierResilienceGuard resilienceGuard,
                       ObjectMapper objectMapper,
                       @Qualifier("cacheIoExecutor") Executor ioExecutor,
                       CacheProperties cacheProperties,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this(keyNormalizer, ttlPolicy, statsCollector, volatileTier, durableTier, resilienceGuard, objectMapper,
            ioExecutor, cacheProperties.getDurableTier().getQueryTimeout(), clock, meterRegistry);
    }

    public TierManager(KeyNormalizer keyNormalizer,
                       TtlPolicy ttlPolicy,
                       StatsCollector statsCollector,
                       VolatileTier volatileTier,
                       DurableTier durableTier,
                       TierResilienceGuard resilienceGuard,
                       ObjectMapper objectMapper,
                       Executor ioExecutor,
                       Duration durableTimeout,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this.keyNormalizer = keyNormalizer;
        this.ttlPolicy = ttlPolicy;
        this.statsCollector = statsCollector;
        this.volatileTier = volatileTier;
        this.durableTier = durableTier;
        this.resilienceGuard = resilienceGuard;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
        this.durableTimeout = durableTimeout;
        this.clock = clock;

        for (CacheSource source : CacheSource.values()) {
            lookupTimers.put(source, Timer.builder("property.cache.lookup.latency")
                .tag("source", source.name().toLowerCase())
                .register(meterRegistry));
        }
        this.writeTimer = Timer.builder("property.cache.write.latency").register(meterRegistry);
    }

    // ==================== 读取 ====================

    public <T> CompletableFuture<CacheLookup<T>> get(String type, Map<String, ?> params, Class<T> payloadType) {
        return get(type, params, CacheOptions.defaults(), payloadType);
    }

    /**
     * 多级缓存读取（核心方法）
     *
     * @throws com.realestate.cache.exception.NormalizationException 参数不合法，同步抛出
     */
    public <T> CompletableFuture<CacheLookup<T>> get(String type, Map<String, ?> params,
                                                     CacheOptions options, Class<T> payloadType) {
        long start = System.nanoTime();
        GeneratedKey generated = keyNormalizer.generateKey(type, params, keyOptions(options));
        return lookup(generated, payloadType, start);
    }

    private <T> CompletableFuture<CacheLookup<T>> lookup(GeneratedKey generated, Class<T> payloadType, long start) {
        String key = generated.key();
        TtlRule rule = ttlPolicy.ruleFor(generated.type());
        statsCollector.recordRequest();

        return readVolatile(key, payloadType).thenCompose(hit -> {
            if (hit.isPresent()) {
                statsCollector.recordVolatileHit(rule.estimatedUnitCost());
                log.debug("Volatile hit: {}", key);
                return CompletableFuture.completedFuture(
                    finish(new CacheLookup<>(hit.get(), CacheSource.VOLATILE, true, false, key, 0), start));
            }
            statsCollector.recordVolatileMiss();
            return readDurable(generated, payloadType, rule, start);
        });
    }

    /**
     * 读易失层，数据损坏时在同一任务内删除，避免与后续回填交错
     */
    private <T> CompletableFuture<Optional<T>> readVolatile(String key, Class<T> payloadType) {
        return CompletableFuture.supplyAsync(() -> {
            String raw = resilienceGuard.onVolatile(() -> volatileTier.get(key));
            if (raw == null) {
                return Optional.<T>empty();
            }
            try {
                return Optional.ofNullable(objectMapper.readValue(raw, payloadType));
            } catch (JsonProcessingException e) {
                log.warn("Corrupted volatile entry {}, deleting and falling back to durable tier: {}",
                    key, e.getOriginalMessage());
                resilienceGuard.runOnVolatile(() -> volatileTier.delete(key));
                return Optional.<T>empty();
            }
        }, ioExecutor).exceptionally(ex -> {
            log.warn("Volatile tier read failed for {}, treating as miss: {}", key, rootMessage(ex));
            return Optional.empty();
        });
    }

    private <T> CompletableFuture<CacheLookup<T>> readDurable(GeneratedKey generated, Class<T> payloadType,
                                                              TtlRule rule, long start) {
        String key = generated.key();
        return CompletableFuture.supplyAsync(
                () -> resilienceGuard.onDurable(() -> durableTier.findByParams(key, generated.normalizedParams())),
                ioExecutor)
            .orTimeout(durableTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                log.warn("Durable tier read failed for {}, treating as miss: {}", key, rootMessage(ex));
                return Optional.empty();
            })
            .thenCompose(found -> {
                Optional<T> data = found.flatMap(record -> decodeDurable(record, payloadType));
                if (data.isEmpty()) {
                    statsCollector.recordMiss(key, rule.estimatedUnitCost());
                    log.debug("Cache miss on all tiers: {}", key);
                    return CompletableFuture.completedFuture(finish(CacheLookup.<T>miss(key, 0), start));
                }
                DurableRecord record = found.get();
                statsCollector.recordDurableHit(record.estimatedUnitCost());
                log.debug("Durable hit: {} (accessCount={})", key, record.accessCount());

                long ttl = promotionTtlSeconds(generated.type(), record);
                return promote(key, record.payloadJson(), ttl).thenApply(warmed ->
                    finish(new CacheLookup<>(data.get(), CacheSource.DURABLE, true, warmed, key, 0), start));
            });
    }

    private <T> Optional<T> decodeDurable(DurableRecord record, Class<T> payloadType) {
        try {
            return Optional.ofNullable(objectMapper.readValue(record.payloadJson(), payloadType));
        } catch (JsonProcessingException e) {
            log.warn("Durable payload for {} cannot be read as {}, treating as miss: {}",
                record.key(), payloadType.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * 回填 TTL：min(策略 TTL, 上限, 持久层剩余存活时间)，易失层副本不得晚于持久层过期
     */
    private long promotionTtlSeconds(String type, DurableRecord record) {
        long remaining = Duration.between(clock.instant(), record.expiresAt()).getSeconds();
        return Math.min(ttlPolicy.volatileTtlSeconds(type, null), remaining);
    }

    /**
     * 持久层命中后回填易失层
     *
     * @return 是否回填成功；剩余存活时间不足 1 秒时不回填
     */
    private CompletableFuture<Boolean> promote(String key, String payloadJson, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            log.debug("Skip promotion of {}, durable entry expires within a second", key);
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.supplyAsync(() -> {
                resilienceGuard.runOnVolatile(() -> volatileTier.set(key, payloadJson, ttlSeconds));
                return true;
            }, ioExecutor)
            .exceptionally(ex -> {
                log.warn("Promotion to volatile tier failed for {}: {}", key, rootMessage(ex));
                return false;
            });
    }

    private <T> CacheLookup<T> finish(CacheLookup<T> lookup, long start) {
        long elapsed = System.nanoTime() - start;
        statsCollector.recordLatency(elapsed);
        lookupTimers.get(lookup.source()).record(elapsed, TimeUnit.NANOSECONDS);
        return new CacheLookup<>(lookup.data(), lookup.source(), lookup.cached(), lookup.warmed(),
            lookup.key(), toMillis(elapsed));
    }

    // ==================== 写入 ====================

    public CompletableFuture<CacheWriteResult> set(String type, Map<String, ?> params, Object payload) {
        return set(type, params, payload, CacheOptions.defaults());
    }

    /**
     * 写入缓存
     * 易失层总是写入；持久层仅在数据类别允许或优先级为 HIGH 时写入
     *
     * @throws com.realestate.cache.exception.NormalizationException 参数不合法或 ttlSeconds 非正，同步抛出
     */
    public CompletableFuture<CacheWriteResult> set(String type, Map<String, ?> params, Object payload,
                                                   CacheOptions options) {
        CacheOptions opts = options != null ? options : CacheOptions.defaults();
        GeneratedKey generated = keyNormalizer.generateKey(type, params, opts.toKeyOptions());
        TtlPolicy.requirePositive(opts.getTtlSeconds());
        return store(generated, payload, opts);
    }

    private CompletableFuture<CacheWriteResult> store(GeneratedKey generated, Object payload, CacheOptions opts) {
        long start = System.nanoTime();
        String key = generated.key();
        String type = generated.type();
        TtlRule rule = ttlPolicy.ruleFor(type);
        long volatileTtl = ttlPolicy.volatileTtlSeconds(type, opts.getTtlSeconds());
        long durableTtl = ttlPolicy.durableTtlSeconds(type, opts.getTtlSeconds());

        String payloadJson;
        try {
            if (payload == null) {
                throw new IllegalArgumentException("payload is null");
            }
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Payload for {} cannot be serialized, nothing stored: {}", key, e.getMessage());
            return CompletableFuture.completedFuture(
                new CacheWriteResult(key, false, false, volatileTtl, durableTtl, toMillis(System.nanoTime() - start)));
        }

        CachePriority priority = opts.getPriority() != null ? opts.getPriority() : CachePriority.NORMAL;
        double unitCost = opts.getEstimatedCost() != null ? opts.getEstimatedCost() : rule.estimatedUnitCost();
        Map<String, Object> metadata = buildMetadata(type, priority, unitCost, payloadJson, durableTtl, opts.getMetadata());

        CompletableFuture<Boolean> volatileWrite = CompletableFuture.supplyAsync(() -> {
                resilienceGuard.runOnVolatile(() -> volatileTier.set(key, payloadJson, volatileTtl));
                return true;
            }, ioExecutor)
            .exceptionally(ex -> {
                log.warn("Volatile tier write failed for {}: {}", key, rootMessage(ex));
                return false;
            });

        CompletableFuture<Boolean> durableWrite;
        if (rule.durableEligible() || priority == CachePriority.HIGH) {
            DurableWrite write = new DurableWrite(key, type, generated.normalizedParams(), payloadJson,
                durableTtl, unitCost, metadata);
            durableWrite = CompletableFuture.supplyAsync(() -> resilienceGuard.onDurable(() -> durableTier.upsert(write)),
                    ioExecutor)
                .orTimeout(durableTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(record -> true)
                .exceptionally(ex -> {
                    log.warn("Durable tier write failed for {}: {}", key, rootMessage(ex));
                    return false;
                });
        } else {
            durableWrite = CompletableFuture.completedFuture(false);
        }

        return volatileWrite.thenCombine(durableWrite, (volatileStored, durableStored) -> {
            statsCollector.recordWrite();
            long elapsed = System.nanoTime() - start;
            writeTimer.record(elapsed, TimeUnit.NANOSECONDS);
            log.debug("Cached {} (volatile={}, durable={}, volatileTtl={}s, durableTtl={}s)",
                key, volatileStored, durableStored, volatileTtl, durableTtl);
            return new CacheWriteResult(key, volatileStored, durableStored, volatileTtl, durableTtl, toMillis(elapsed));
        });
    }

    private Map<String, Object> buildMetadata(String type, CachePriority priority, double unitCost,
                                              String payloadJson, long ttlSeconds, Map<String, Object> extra) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (extra != null) {
            metadata.putAll(extra);
        }
        metadata.put(CacheConstants.META_CACHE_TYPE, type);
        metadata.put(CacheConstants.META_PRIORITY, priority.name().toLowerCase());
        metadata.put(CacheConstants.META_ESTIMATED_COST, unitCost);
        metadata.put(CacheConstants.META_DATA_SIZE, payloadJson.getBytes(StandardCharsets.UTF_8).length);
        metadata.put(CacheConstants.META_TIMESTAMP, clock.millis());
        metadata.put(CacheConstants.META_TTL, ttlSeconds);
        return metadata;
    }

    // ==================== 读穿透 ====================

    /**
     * 读取，未命中时调用 fetcher 回源并写入缓存
     * 同一 Key 并发未命中时只回源一次，所有等待方共享结果
     *
     * @return 回源失败时以 {@link UpstreamFetchException} 异常完成，且不写缓存
     */
    public <T> CompletableFuture<CacheLookup<T>> getOrFetch(String type, Map<String, ?> params, CacheOptions options,
                                                            Class<T> payloadType, Supplier<? extends T> fetcher) {
        long start = System.nanoTime();
        CacheOptions opts = options != null ? options : CacheOptions.defaults();
        GeneratedKey generated = keyNormalizer.generateKey(type, params, opts.toKeyOptions());
        TtlPolicy.requirePositive(opts.getTtlSeconds());
        return lookup(generated, payloadType, start).thenCompose(result -> {
            if (result.cached()) {
                return CompletableFuture.completedFuture(result);
            }
            return fetchShared(generated, opts, fetcher).thenApply(data -> new CacheLookup<>(
                payloadType.cast(data), CacheSource.NONE, false, false, generated.key(),
                toMillis(System.nanoTime() - start)));
        });
    }

    private CompletableFuture<Object> fetchShared(GeneratedKey generated, CacheOptions opts,
                                                  Supplier<?> fetcher) {
        String key = generated.key();
        CompletableFuture<Object> shared = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlightFetches.putIfAbsent(key, shared);
        if (existing != null) {
            log.debug("Joining in-flight fetch for {}", key);
            return existing;
        }

        CompletableFuture.<Object>supplyAsync(fetcher::get, ioExecutor)
            .thenCompose(data -> {
                if (data == null) {
                    log.debug("Fetcher returned null for {}, nothing cached", key);
                    return CompletableFuture.<Object>completedFuture(null);
                }
                return store(generated, data, opts).thenApply(written -> data);
            })
            .whenComplete((data, ex) -> {
                inFlightFetches.remove(key, shared);
                if (ex != null) {
                    Throwable cause = unwrap(ex);
                    log.warn("Upstream fetch failed for {}: {}", key, cause.getMessage());
                    shared.completeExceptionally(new UpstreamFetchException(key, cause));
                } else {
                    shared.complete(data);
                }
            });
        return shared;
    }

    int inFlightFetchCount() {
        return inFlightFetches.size();
    }

    // ==================== 驱逐 ====================

    /**
     * 删除单个 Key（两层）
     */
    public CompletableFuture<CacheEviction> evict(String type, Map<String, ?> params, CacheOptions options) {
        CacheOptions opts = options != null ? options : CacheOptions.defaults();
        String key = keyNormalizer.generateKey(type, params, opts.toKeyOptions()).key();
        return evictKey(key);
    }

    public CompletableFuture<CacheEviction> evictKey(String key) {
        List<String> errors = new ArrayList<>();
        CompletableFuture<Boolean> volatileDelete = CompletableFuture.supplyAsync(() -> {
                resilienceGuard.runOnVolatile(() -> volatileTier.delete(key));
                return true;
            }, ioExecutor)
            .exceptionally(ex -> {
                log.warn("Volatile tier delete failed for {}: {}", key, rootMessage(ex));
                synchronized (errors) {
                    errors.add("volatile: " + rootMessage(ex));
                }
                return false;
            });
        CompletableFuture<Boolean> durableDelete = CompletableFuture.supplyAsync(
                () -> resilienceGuard.onDurable(() -> durableTier.delete(key)), ioExecutor)
            .orTimeout(durableTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                log.warn("Durable tier delete failed for {}: {}", key, rootMessage(ex));
                synchronized (errors) {
                    errors.add("durable: " + rootMessage(ex));
                }
                return false;
            });
        return volatileDelete.thenCombine(durableDelete, (volatileDeleted, durableDeleted) -> {
            log.info("Evicted cache key {} (volatile={}, durable={})", key, volatileDeleted, durableDeleted);
            synchronized (errors) {
                return new CacheEviction(key, volatileDeleted, durableDeleted, errors);
            }
        });
    }

    // ==================== 工具方法 ====================

    private static KeyOptions keyOptions(CacheOptions options) {
        return options != null ? options.toKeyOptions() : KeyOptions.defaults();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = unwrap(ex);
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }

    private static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
