package com.bastion.repository;

import com.bastion.exception.CacheStoreException;
import com.bastion.model.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-process cache store backed by Caffeine, expiring each entry after its own TTL.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<StoreKey, StoredEntry> cache;

    public CaffeineCacheStore(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public Mono<CacheEntry> get(String namespace, String key) {
        return Mono.fromCallable(() -> {
            StoredEntry stored = cache.getIfPresent(new StoreKey(namespace, key));
            return stored == null ? null : stored.getEntry();
        }).onErrorMap(e -> !(e instanceof CacheStoreException),
                e -> new CacheStoreException("Error reading " + namespace + ":" + key, e));
    }

    @Override
    public Mono<Void> set(String namespace, String key, CacheEntry entry, long ttlSeconds) {
        return Mono.fromRunnable(() -> {
            if (ttlSeconds <= 0) {
                return;
            }
            cache.put(new StoreKey(namespace, key), new StoredEntry(entry, TimeUnit.SECONDS.toNanos(ttlSeconds)));
            log.debug("Stored in memory cache: ns={}, key={}, ttl={}s", namespace, key, ttlSeconds);
        });
    }

    @Override
    public Mono<Long> deleteByPattern(String namespace, String pattern) {
        Predicate<String> matcher = KeyPattern.compile(pattern);
        return Mono.fromCallable(() -> invalidateWhere(
                storeKey -> storeKey.getNamespace().equals(namespace) && matcher.test(storeKey.getKey())));
    }

    @Override
    public Mono<Long> deleteNamespace(String namespace) {
        return Mono.fromCallable(() -> invalidateWhere(storeKey -> storeKey.getNamespace().equals(namespace)));
    }

    @Override
    public Mono<Long> deleteAll() {
        return Mono.fromCallable(() -> {
            long size = cache.estimatedSize();
            cache.invalidateAll();
            cache.cleanUp();
            return size;
        });
    }

    private long invalidateWhere(Predicate<StoreKey> predicate) {
        List<StoreKey> keys = cache.asMap().keySet().stream()
                .filter(predicate)
                .collect(Collectors.toList());
        cache.invalidateAll(keys);
        return keys.size();
    }

    @Value
    private static class StoreKey {
        String namespace;
        String key;
    }

    @Value
    private static class StoredEntry {
        CacheEntry entry;
        long ttlNanos;
    }

    private static final class PerEntryExpiry implements Expiry<StoreKey, StoredEntry> {

        @Override
        public long expireAfterCreate(StoreKey key, StoredEntry value, long currentTime) {
            return value.getTtlNanos();
        }

        @Override
        public long expireAfterUpdate(StoreKey key, StoredEntry value, long currentTime, long currentDuration) {
            return value.getTtlNanos();
        }

        @Override
        public long expireAfterRead(StoreKey key, StoredEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
