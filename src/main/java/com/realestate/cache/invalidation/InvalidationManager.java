package com.realestate.cache.invalidation;

import com.realestate.cache.dto.CacheOptions;
import com.realestate.cache.exception.NormalizationException;
import com.realestate.cache.service.TierManager;
import com.realestate.cache.service.TierResilienceGuard;
import com.realestate.cache.tier.DurableTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 缓存失效
 *
 * 模式失效只作用于持久层。易失层没有按类型的 Key 索引，
 * 按模式扫描 Redis（KEYS / SCAN）在生产环境代价过高，请求时只在结果中标记 volatileSkipped，
 * 残留的易失层副本随 TTL（最长为易失层上限）自然过期。
 */
@Component
public class InvalidationManager {

    private static final Logger log = LoggerFactory.getLogger(InvalidationManager.class);

    private final TierManager tierManager;
    private final DurableTier durableTier;
    private final TierResilienceGuard resilienceGuard;
    private final Executor ioExecutor;

    public InvalidationManager(TierManager tierManager,
                               DurableTier durableTier,
                               TierResilienceGuard resilienceGuard,
                               @Qualifier("cacheIoExecutor") Executor ioExecutor) {
        this.tierManager = tierManager;
        this.durableTier = durableTier;
        this.resilienceGuard = resilienceGuard;
        this.ioExecutor = ioExecutor;
    }

    public CompletableFuture<InvalidationResult> invalidate(String pattern) {
        return invalidate(pattern, InvalidationOptions.defaults());
    }

    /**
     * 按模式删除持久层条目
     *
     * @throws NormalizationException 模式为空或无法编译，同步抛出
     */
    public CompletableFuture<InvalidationResult> invalidate(String pattern, InvalidationOptions options) {
        InvalidationOptions opts = options != null ? options : InvalidationOptions.defaults();
        Pattern compiled = compile(pattern, opts.syntax());
        boolean volatileSkipped = opts.includeVolatile();
        if (volatileSkipped) {
            log.warn("Pattern invalidation is not supported on the volatile tier, skipped for pattern {}", pattern);
        }
        if (!opts.includeDurable()) {
            return CompletableFuture.completedFuture(new InvalidationResult(0, 0, volatileSkipped, List.of()));
        }

        return CompletableFuture.supplyAsync(() -> resilienceGuard.onDurable(() -> durableTier.deleteMatching(compiled)),
                ioExecutor)
            .thenApply(deleted -> {
                log.info("Invalidated {} durable entries matching {}", deleted, pattern);
                return new InvalidationResult(0, deleted, volatileSkipped, List.of());
            })
            .exceptionally(ex -> {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Durable invalidation failed for pattern {}: {}", pattern, cause.toString());
                return new InvalidationResult(0, 0, volatileSkipped, List.of("durable: " + cause));
            });
    }

    /**
     * 删除单个精确 Key（两层）
     */
    public CompletableFuture<InvalidationResult> invalidateKey(String type, Map<String, ?> params, CacheOptions options) {
        return tierManager.evict(type, params, options).thenApply(eviction -> new InvalidationResult(
            eviction.volatileDeleted() ? 1 : 0,
            eviction.durableDeleted() ? 1 : 0,
            false,
            eviction.errors()));
    }

    static Pattern compile(String pattern, PatternSyntax syntax) {
        if (pattern == null || pattern.isBlank()) {
            throw new NormalizationException("Invalidation pattern must not be blank");
        }
        String regex = syntax == PatternSyntax.GLOB ? globToRegex(pattern) : pattern;
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new NormalizationException("Invalid invalidation pattern: " + pattern, e);
        }
    }

    private static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append('$').toString();
    }
}
