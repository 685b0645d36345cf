package com.realestate.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.realestate.cache.repository.CacheRecordRepository;
import com.realestate.cache.tier.CaffeineVolatileTier;
import com.realestate.cache.tier.DurableTier;
import com.realestate.cache.tier.InMemoryDurableTier;
import com.realestate.cache.tier.JpaDurableTier;
import com.realestate.cache.tier.RedisVolatileTier;
import com.realestate.cache.tier.VolatileTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 缓存引擎装配
 * 按配置选择易失层（redis / local）与持久层（jpa / memory）实现
 */
@Configuration
public class CacheEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheEngineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 层间 I/O 线程池，慢层只阻塞自己的调用方
     */
    @Bean("cacheIoExecutor")
    public ThreadPoolTaskExecutor cacheIoExecutor(CacheProperties cacheProperties) {
        CacheProperties.IoConfig io = cacheProperties.getIo();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(io.getCorePoolSize());
        executor.setMaxPoolSize(io.getMaxPoolSize());
        executor.setQueueCapacity(io.getQueueCapacity());
        executor.setThreadNamePrefix("cache-io-");
        // 队列打满时由调用方线程执行，形成自然背压
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        log.info("Cache IO executor initialized: core={}, max={}, queue={}",
            io.getCorePoolSize(), io.getMaxPoolSize(), io.getQueueCapacity());
        return executor;
    }

    /**
     * 异步预热专用单线程池，与 I/O 线程池隔离
     */
    @Bean("cacheWarmupExecutor")
    public ThreadPoolTaskExecutor cacheWarmupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("cache-warmer-");
        executor.setDaemon(true);
        // 停机时中断进行中的预热，剩余条目记为失败
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ==================== 易失层 ====================

    @Bean
    @ConditionalOnProperty(prefix = "property-cache.volatile-tier", name = "mode", havingValue = "redis", matchIfMissing = true)
    public VolatileTier redisVolatileTier(StringRedisTemplate stringRedisTemplate) {
        log.info("Volatile tier: redis");
        return new RedisVolatileTier(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "property-cache.volatile-tier", name = "mode", havingValue = "local")
    public VolatileTier caffeineVolatileTier(
            @Qualifier("volatileLocalCache") Cache<String, CaffeineVolatileTier.LocalEntry> volatileLocalCache) {
        log.info("Volatile tier: local caffeine");
        return new CaffeineVolatileTier(volatileLocalCache);
    }

    // ==================== 持久层 ====================

    @Bean
    @ConditionalOnProperty(prefix = "property-cache.durable-tier", name = "mode", havingValue = "jpa", matchIfMissing = true)
    public DurableTier jpaDurableTier(CacheRecordRepository cacheRecordRepository, ObjectMapper objectMapper, Clock clock) {
        log.info("Durable tier: jpa");
        return new JpaDurableTier(cacheRecordRepository, objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "property-cache.durable-tier", name = "mode", havingValue = "memory")
    public DurableTier inMemoryDurableTier(Clock clock) {
        log.info("Durable tier: in-memory");
        return new InMemoryDurableTier(clock);
    }
}
