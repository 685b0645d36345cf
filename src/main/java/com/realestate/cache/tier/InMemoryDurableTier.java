package com.realestate.cache.tier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 内存持久层（本地开发 / 测试使用，进程重启即丢失）
 */
public class InMemoryDurableTier implements DurableTier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDurableTier.class);

    private final Map<String, DurableRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDurableTier(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Optional<DurableRecord> findByParams(String key, Map<String, Object> normalizedParams) {
        Instant now = clock.instant();
        AtomicBoolean collision = new AtomicBoolean(false);
        DurableRecord touched = records.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (!existing.normalizedParams().equals(normalizedParams)) {
                collision.set(true);
                return existing;
            }
            long count = existing.accessCount() + 1;
            return new DurableRecord(k, existing.type(), existing.normalizedParams(), existing.payloadJson(),
                existing.createdAt(), now, existing.expiresAt(), count, existing.estimatedUnitCost(),
                DurableRecord.costSaved(existing.estimatedUnitCost(), count), existing.metadata());
        });
        if (collision.get()) {
            log.warn("Durable key {} holds different params, treating as miss (hash collision)", key);
            return Optional.empty();
        }
        return Optional.ofNullable(touched);
    }

    @Override
    public DurableRecord upsert(DurableWrite write) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(write.ttlSeconds());
        AtomicReference<DurableRecord> result = new AtomicReference<>();
        records.compute(write.key(), (k, existing) -> {
            DurableRecord updated;
            if (existing == null || existing.isExpired(now)) {
                updated = new DurableRecord(k, write.type(), copy(write.normalizedParams()),
                    write.payloadJson(), now, now, expiresAt, 1, write.estimatedUnitCost(), 0,
                    copy(write.metadata()));
            } else {
                long count = existing.accessCount() + 1;
                updated = new DurableRecord(k, write.type(), copy(write.normalizedParams()),
                    write.payloadJson(), existing.createdAt(), now, expiresAt, count, write.estimatedUnitCost(),
                    DurableRecord.costSaved(write.estimatedUnitCost(), count), copy(write.metadata()));
            }
            result.set(updated);
            return updated;
        });
        return result.get();
    }

    @Override
    public int deleteMatching(Pattern pattern) {
        AtomicInteger deleted = new AtomicInteger();
        records.keySet().removeIf(key -> {
            boolean matched = pattern.matcher(key).find();
            if (matched) {
                deleted.incrementAndGet();
            }
            return matched;
        });
        return deleted.get();
    }

    @Override
    public boolean delete(String key) {
        return records.remove(key) != null;
    }

    @Override
    public DurableTierSummary summarize() {
        long entries = 0;
        long accesses = 0;
        double saved = 0;
        for (DurableRecord record : records.values()) {
            entries++;
            accesses += record.accessCount();
            saved += record.cumulativeCostSaved();
        }
        return new DurableTierSummary(entries, accesses, saved);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        return removeWhere(record -> record.isExpired(now));
    }

    @Override
    public int purgeStale(Duration idleFor, int minAccessCount) {
        Instant cutoff = clock.instant().minus(idleFor);
        return removeWhere(record ->
            record.lastAccessedAt().isBefore(cutoff) && record.accessCount() < minAccessCount);
    }

    private int removeWhere(Predicate<DurableRecord> condition) {
        AtomicInteger removed = new AtomicInteger();
        records.values().removeIf(record -> {
            boolean matched = condition.test(record);
            if (matched) {
                removed.incrementAndGet();
            }
            return matched;
        });
        return removed.get();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
