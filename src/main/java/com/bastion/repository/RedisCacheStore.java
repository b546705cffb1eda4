package com.bastion.repository;

import com.bastion.exception.CacheStoreException;
import com.bastion.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis cache store with compression, shareable between gateway instances.
 * Key pattern: cache:{namespace}:{key}
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final String KEY_PREFIX = "cache:";
    private static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCacheStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<CacheEntry> get(String namespace, String key) {
        String redisKey = buildKey(namespace, key);
        return blocking("get " + redisKey, () -> {
            byte[] compressed = redisTemplate.opsForValue().get(redisKey);
            if (compressed == null) {
                log.debug("Redis cache miss: {}", redisKey);
                return null;
            }
            return decompress(compressed);
        });
    }

    @Override
    public Mono<Void> set(String namespace, String key, CacheEntry entry, long ttlSeconds) {
        String redisKey = buildKey(namespace, key);
        return blocking("set " + redisKey, () -> {
            if (ttlSeconds <= 0) {
                log.debug("Skipping Redis cache write with non-positive TTL: {}", redisKey);
                return null;
            }
            byte[] compressed = compress(entry);
            redisTemplate.opsForValue().set(redisKey, compressed, Duration.ofSeconds(ttlSeconds));
            log.debug("Stored in Redis cache: key={}, ttl={}s, size={}KB",
                    redisKey, ttlSeconds, compressed.length / 1024);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Long> deleteByPattern(String namespace, String pattern) {
        String namespacePrefix = KEY_PREFIX + namespace + ":";
        Predicate<String> matcher = KeyPattern.compile(pattern);
        return blocking("delete " + namespacePrefix + pattern, () -> deleteScanned(namespacePrefix + "*",
                redisKey -> matcher.test(redisKey.substring(namespacePrefix.length()))));
    }

    @Override
    public Mono<Long> deleteNamespace(String namespace) {
        return blocking("delete namespace " + namespace,
                () -> deleteScanned(KEY_PREFIX + namespace + ":*", redisKey -> true));
    }

    @Override
    public Mono<Long> deleteAll() {
        return blocking("delete all", () -> {
            long removed = deleteScanned(KEY_PREFIX + "*", redisKey -> true);
            log.info("Cleared {} entries from Redis cache", removed);
            return removed;
        });
    }

    private long deleteScanned(String match, Predicate<String> filter) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(match).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(redisKey -> {
                if (filter.test(redisKey)) {
                    keys.add(redisKey);
                }
            });
        }
        if (keys.isEmpty()) {
            return 0;
        }
        Long removed = redisTemplate.delete(keys);
        return removed == null ? 0 : removed;
    }

    /**
     * Runs a blocking Redis call off the event loop.
     */
    private <T> Mono<T> blocking(String description, Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> new CacheStoreException("Redis " + description + " failed", e));
    }

    private String buildKey(String namespace, String key) {
        return KEY_PREFIX + namespace + ":" + key;
    }

    private byte[] compress(CacheEntry entry) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {

            byte[] json = objectMapper.writeValueAsBytes(entry);
            gzipOut.write(json);
            gzipOut.finish();

            return baos.toByteArray();
        }
    }

    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipIn = new GZIPInputStream(bais)) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        }
    }
}
