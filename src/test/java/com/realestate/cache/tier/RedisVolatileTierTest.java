package com.realestate.cache.tier;

import com.realestate.cache.exception.VolatileTierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Redis 易失层单元测试
 */
@ExtendWith(MockitoExtension.class)
class RedisVolatileTierTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisVolatileTier volatileTier;

    @BeforeEach
    void setUp() {
        volatileTier = new RedisVolatileTier(redisTemplate);
    }

    @Test
    @DisplayName("读取委托给 Redis")
    void testGet() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("discovery:abc")).thenReturn("{}");

        assertEquals("{}", volatileTier.get("discovery:abc"));
    }

    @Test
    @DisplayName("写入携带秒级 TTL")
    void testSetWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        volatileTier.set("discovery:abc", "{}", 3600);

        verify(valueOperations).set("discovery:abc", "{}", 3600, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("非正 TTL 不访问 Redis")
    void testNonPositiveTtlSkipped() {
        volatileTier.set("discovery:abc", "{}", 0);

        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Redis 异常包装为 VolatileTierException")
    void testFailureWrapped() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        VolatileTierException e = assertThrows(VolatileTierException.class, () -> volatileTier.get("k"));
        assertEquals("volatile", e.tier());
    }

    @Test
    @DisplayName("删除")
    void testDelete() {
        volatileTier.delete("discovery:abc");

        verify(redisTemplate).delete("discovery:abc");
    }
}
