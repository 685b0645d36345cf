package com.realestate.cache.warmup;

import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.constant.CacheConstants;
import com.realestate.cache.constant.CachePriority;
import com.realestate.cache.dto.CacheOptions;
import com.realestate.cache.dto.CacheWriteResult;
import com.realestate.cache.service.TierManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 缓存预热
 * 批间串行（批间固定延迟保护上游限流），批内并发；单条失败不影响同批其它条目
 */
@Component
public class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private final TierManager tierManager;
    private final Executor ioExecutor;
    private final int defaultBatchSize;
    private final Duration batchDelay;
    private final Duration itemTimeout;

    // warmAsync 专用，避免预热任务占满 I/O 线程池后自我等待
    private final Executor warmupExecutor;

    @Autowired
    public CacheWarmer(TierManager tierManager,
                       @Qualifier("cacheIoExecutor") Executor ioExecutor,
                       @Qualifier("cacheWarmupExecutor") Executor warmupExecutor,
                       CacheProperties cacheProperties) {
        this(tierManager, ioExecutor, warmupExecutor,
            cacheProperties.getWarmer().getBatchSize(),
            cacheProperties.getWarmer().getBatchDelay(),
            cacheProperties.getWarmer().getItemTimeout());
    }

    public CacheWarmer(TierManager tierManager, Executor ioExecutor, Executor warmupExecutor,
                       int defaultBatchSize, Duration batchDelay, Duration itemTimeout) {
        if (defaultBatchSize < 1) {
            throw new IllegalArgumentException("Warmup batch size must be positive: " + defaultBatchSize);
        }
        this.tierManager = tierManager;
        this.ioExecutor = ioExecutor;
        this.warmupExecutor = warmupExecutor;
        this.defaultBatchSize = defaultBatchSize;
        this.batchDelay = batchDelay;
        this.itemTimeout = itemTimeout;
    }

    public WarmupReport warm(String type, List<? extends Map<String, ?>> paramsList,
                             Function<Map<String, ?>, ?> fetchFn) {
        return warm(type, paramsList, fetchFn, defaultBatchSize);
    }

    /**
     * 批量预热（阻塞直到全部批次完成）
     *
     * @param fetchFn   回源函数，可为 null（此时只统计缓存情况）
     * @param batchSize 批大小
     */
    public WarmupReport warm(String type, List<? extends Map<String, ?>> paramsList,
                             Function<Map<String, ?>, ?> fetchFn, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Warmup batch size must be positive: " + batchSize);
        }
        log.info("Starting cache warmup for type {}: {} entries, batchSize={}", type, paramsList.size(), batchSize);

        List<WarmupItemResult> results = new ArrayList<>(paramsList.size());
        for (int from = 0; from < paramsList.size(); from += batchSize) {
            List<? extends Map<String, ?>> batch = paramsList.subList(from, Math.min(from + batchSize, paramsList.size()));

            List<CompletableFuture<WarmupItemResult>> futures = batch.stream()
                .map(params -> warmItem(type, params, fetchFn))
                .toList();
            futures.forEach(future -> results.add(future.join()));

            boolean hasNext = from + batchSize < paramsList.size();
            if (hasNext && !pauseBetweenBatches()) {
                log.warn("Cache warmup for type {} interrupted after {} entries", type, results.size());
                for (Map<String, ?> params : paramsList.subList(from + batchSize, paramsList.size())) {
                    results.add(WarmupItemResult.error(params, "interrupted"));
                }
                break;
            }
        }

        WarmupReport report = WarmupReport.of(results);
        log.info("Cache warmup complete for type {}: warmed={}, alreadyCached={}, errors={}",
            type, report.warmed(), report.alreadyCached(), report.errors());
        return report;
    }

    /**
     * 异步预热，调用方线程立即返回
     */
    public CompletableFuture<WarmupReport> warmAsync(String type, List<? extends Map<String, ?>> paramsList,
                                                     Function<Map<String, ?>, ?> fetchFn, int batchSize) {
        return CompletableFuture.supplyAsync(() -> warm(type, paramsList, fetchFn, batchSize), warmupExecutor);
    }

    private CompletableFuture<WarmupItemResult> warmItem(String type, Map<String, ?> params,
                                                         Function<Map<String, ?>, ?> fetchFn) {
        CompletableFuture<WarmupItemResult> item;
        try {
            item = tierManager.get(type, params, Object.class).thenCompose(lookup -> {
                if (lookup.cached()) {
                    return CompletableFuture.completedFuture(WarmupItemResult.of(params, WarmupStatus.ALREADY_CACHED));
                }
                if (fetchFn == null) {
                    return CompletableFuture.completedFuture(WarmupItemResult.of(params, WarmupStatus.NO_FETCH_FUNCTION));
                }
                return CompletableFuture.supplyAsync(() -> fetchFn.apply(params), ioExecutor)
                    .thenCompose(data -> {
                        if (data == null) {
                            return CompletableFuture.completedFuture(
                                WarmupItemResult.error(params, "fetch function returned no data"));
                        }
                        return tierManager.set(type, params, data, warmedOptions())
                            .thenApply(written -> toResult(params, written));
                    });
            });
        } catch (RuntimeException e) {
            // 参数规范化失败同步抛出
            log.warn("Cache warmup rejected params {}: {}", params, e.getMessage());
            return CompletableFuture.completedFuture(WarmupItemResult.error(params, e.getMessage()));
        }

        return item.orTimeout(itemTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                String message = cause instanceof TimeoutException
                    ? "timed out after " + itemTimeout.toMillis() + "ms"
                    : cause.getMessage();
                log.warn("Cache warmup failed for params {}: {}", params, message);
                return WarmupItemResult.error(params, message);
            });
    }

    private static WarmupItemResult toResult(Map<String, ?> params, CacheWriteResult written) {
        if (written.volatileStored() || written.durableStored()) {
            return WarmupItemResult.of(params, WarmupStatus.WARMED);
        }
        return WarmupItemResult.error(params, "no tier accepted the write");
    }

    private static CacheOptions warmedOptions() {
        return CacheOptions.builder()
            .priority(CachePriority.NORMAL)
            .metadata(Map.of(CacheConstants.META_WARMED, true))
            .build();
    }

    /**
     * @return false 表示等待期间被中断
     */
    private boolean pauseBetweenBatches() {
        if (batchDelay.isZero() || batchDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(batchDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
