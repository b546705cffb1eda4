package com.bastion.repository;

import com.bastion.model.CacheEntry;
import reactor.core.publisher.Mono;

/**
 * Key-value capability behind the response cache. Keys are scoped by namespace.
 * Implementations signal failures as {@link com.bastion.exception.CacheStoreException}.
 */
public interface CacheStore {

    /**
     * @return the entry, or empty when absent
     */
    Mono<CacheEntry> get(String namespace, String key);

    Mono<Void> set(String namespace, String key, CacheEntry entry, long ttlSeconds);

    /**
     * Removes keys of the namespace matching {@code pattern} (see {@link KeyPattern}).
     *
     * @return number of removed entries
     */
    Mono<Long> deleteByPattern(String namespace, String pattern);

    Mono<Long> deleteNamespace(String namespace);

    Mono<Long> deleteAll();
}
