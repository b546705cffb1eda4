package com.bastion.repository;

import com.bastion.model.CacheEntry;
import com.bastion.model.OperationKind;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CaffeineCacheStore.
 */
class CaffeineCacheStoreTest {

    private AtomicLong nanos;
    private CaffeineCacheStore store;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        store = new CaffeineCacheStore(100, ticker);
    }

    @Test
    void testEntryExpiresAfterItsOwnTtl() {
        store.set("openai", "translation:gpt-4:a", entry("translation:gpt-4:a"), 60).block();
        store.set("openai", "translation:gpt-4:b", entry("translation:gpt-4:b"), 3600).block();

        nanos.addAndGet(Duration.ofSeconds(61).toNanos());

        StepVerifier.create(store.get("openai", "translation:gpt-4:a")).verifyComplete();
        StepVerifier.create(store.get("openai", "translation:gpt-4:b"))
                .assertNext(found -> assertEquals("translation:gpt-4:b", found.getKey()))
                .verifyComplete();
    }

    @Test
    void testNonPositiveTtlIsNotStored() {
        store.set("openai", "k", entry("k"), 0).block();

        StepVerifier.create(store.get("openai", "k")).verifyComplete();
    }

    @Test
    void testNamespacesAreIsolated() {
        store.set("openai", "k", entry("k"), 60).block();
        store.set("serp", "k", entry("k"), 60).block();

        StepVerifier.create(store.deleteNamespace("openai")).expectNext(1L).verifyComplete();
        StepVerifier.create(store.get("openai", "k")).verifyComplete();
        StepVerifier.create(store.get("serp", "k")).expectNextCount(1).verifyComplete();
    }

    @Test
    void testDeleteByPattern() {
        store.set("openai", "translation:gpt-4:a", entry("a"), 60).block();
        store.set("openai", "translation:gpt-4o:b", entry("b"), 60).block();
        store.set("openai", "code_generation:gpt-4:c", entry("c"), 60).block();

        StepVerifier.create(store.deleteByPattern("openai", "*:gpt-4:*")).expectNext(2L).verifyComplete();
        StepVerifier.create(store.get("openai", "translation:gpt-4o:b")).expectNextCount(1).verifyComplete();
    }

    @Test
    void testDeleteAll() {
        store.set("openai", "a", entry("a"), 60).block();
        store.set("firecrawl", "b", entry("b"), 60).block();

        StepVerifier.create(store.deleteAll()).expectNext(2L).verifyComplete();
        StepVerifier.create(store.get("firecrawl", "b")).verifyComplete();
    }

    private static CacheEntry entry(String key) {
        return CacheEntry.builder()
                .key(key)
                .namespace("openai")
                .operation(OperationKind.TRANSLATION)
                .ttlSeconds(60)
                .createdAt(Instant.EPOCH)
                .build();
    }
}
