package com.bastion.repository;

import com.bastion.config.JacksonConfiguration;
import com.bastion.model.CacheEntry;
import com.bastion.model.OperationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RedisCacheStore.
 */
class RedisCacheStoreTest {

    private RedisTemplate<String, byte[]> redisTemplate;
    private ValueOperations<String, byte[]> valueOperations;
    private RedisCacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisCacheStore(redisTemplate, JacksonConfiguration.createObjectMapper());
    }

    @Test
    void testStoresCompressedEntryWithTtl() {
        StepVerifier.create(store.set("serp", "serp_analysis:serp-search:abc", entry(), 86400))
                .verifyComplete();

        verify(valueOperations).set(eq("cache:serp:serp_analysis:serp-search:abc"), any(byte[].class),
                eq(Duration.ofSeconds(86400)));
    }

    @Test
    void testNonPositiveTtlIsNotWritten() {
        StepVerifier.create(store.set("serp", "serp_analysis:serp-search:abc", entry(), 0))
                .verifyComplete();

        verify(valueOperations, never()).set(anyString(), any(byte[].class), any(Duration.class));
    }

    private static CacheEntry entry() {
        return CacheEntry.builder()
                .key("serp_analysis:serp-search:abc")
                .namespace("serp")
                .operation(OperationKind.SERP_ANALYSIS)
                .provider("serper")
                .ttlSeconds(86400)
                .createdAt(Instant.EPOCH)
                .build();
    }
}
