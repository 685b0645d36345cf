package com.realestate.cache.service;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * 缓存层熔断保护
 * 易失层与持久层各一个熔断器；熔断打开时调用直接失败，由 TierManager 按未命中 / 跳过写入处理
 */
@Service
public class TierResilienceGuard {

    private static final Logger log = LoggerFactory.getLogger(TierResilienceGuard.class);

    public static final String VOLATILE = "volatile";
    public static final String DURABLE = "durable";

    // 熔断器配置
    private static final float FAILURE_RATE_THRESHOLD = 50.0f;
    private static final int MINIMUM_CALLS = 10;
    private static final int SLIDING_WINDOW_SIZE = 100;
    private static final Duration WAIT_DURATION_IN_OPEN_STATE = Duration.ofSeconds(30);

    private final CircuitBreaker volatileCircuitBreaker;
    private final CircuitBreaker durableCircuitBreaker;

    @Autowired
    public TierResilienceGuard(MeterRegistry meterRegistry) {
        this(CircuitBreakerRegistry.of(defaultConfig()), meterRegistry);
    }

    public TierResilienceGuard(CircuitBreakerRegistry registry, MeterRegistry meterRegistry) {
        this.volatileCircuitBreaker = registry.circuitBreaker(VOLATILE);
        this.durableCircuitBreaker = registry.circuitBreaker(DURABLE);

        // 注册状态变化监听
        volatileCircuitBreaker.getEventPublisher().onStateTransition(event ->
            log.warn("Volatile tier circuit breaker state changed: {}", event.getStateTransition()));
        durableCircuitBreaker.getEventPublisher().onStateTransition(event ->
            log.warn("Durable tier circuit breaker state changed: {}", event.getStateTransition()));

        meterRegistry.gauge("property.cache.circuit.state", List.of(Tag.of("tier", VOLATILE)),
            volatileCircuitBreaker, cb -> cb.getState().getOrder());
        meterRegistry.gauge("property.cache.circuit.state", List.of(Tag.of("tier", DURABLE)),
            durableCircuitBreaker, cb -> cb.getState().getOrder());
    }

    static CircuitBreakerConfig defaultConfig() {
        return CircuitBreakerConfig.custom()
            .failureRateThreshold(FAILURE_RATE_THRESHOLD)
            .minimumNumberOfCalls(MINIMUM_CALLS)
            .waitDurationInOpenState(WAIT_DURATION_IN_OPEN_STATE)
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(SLIDING_WINDOW_SIZE)
            .build();
    }

    /**
     * 带熔断保护的易失层调用，失败原样抛出（含 CallNotPermittedException）
     */
    public <T> T onVolatile(Supplier<T> action) {
        return volatileCircuitBreaker.executeSupplier(action);
    }

    public void runOnVolatile(Runnable action) {
        volatileCircuitBreaker.executeRunnable(action);
    }

    public <T> T onDurable(Supplier<T> action) {
        return durableCircuitBreaker.executeSupplier(action);
    }

    public CircuitBreaker.State volatileState() {
        return volatileCircuitBreaker.getState();
    }

    public CircuitBreaker.State durableState() {
        return durableCircuitBreaker.getState();
    }

    /**
     * 手动重置熔断器（用于紧急恢复）
     */
    public void reset(String name) {
        switch (name.toLowerCase()) {
            case VOLATILE -> volatileCircuitBreaker.reset();
            case DURABLE -> durableCircuitBreaker.reset();
            default -> {
                log.warn("Unknown circuit breaker: {}", name);
                return;
            }
        }
        log.info("Circuit breaker {} reset", name);
    }

    /**
     * 强制打开熔断器（用于紧急保护，例如持久层维护窗口）
     */
    public void forceOpen(String name) {
        switch (name.toLowerCase()) {
            case VOLATILE -> volatileCircuitBreaker.transitionToForcedOpenState();
            case DURABLE -> durableCircuitBreaker.transitionToForcedOpenState();
            default -> {
                log.warn("Unknown circuit breaker: {}", name);
                return;
            }
        }
        log.warn("Circuit breaker {} forced OPEN", name);
    }
}
