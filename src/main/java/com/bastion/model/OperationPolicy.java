package com.bastion.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Cacheability and TTL policy of one {@link OperationKind}.
 */
@Value
@Builder(toBuilder = true)
public class OperationPolicy {

    boolean enabled;

    Duration ttl;

    /**
     * Cap on the requested output: tokens for completions, results for searches,
     * content bytes for scrapes.
     */
    long maxOutputSize;

    @Singular
    List<String> excludedModels;

    /**
     * Glob patterns ({@code *} wildcard) of URLs that are never cached.
     */
    @Singular
    List<String> excludedUrlPatterns;

    /**
     * Whether URLs that look like dynamic pages (search results, APIs, live feeds) may be cached.
     */
    boolean includeDynamic;

    BigDecimal costThreshold;

    public long ttlSeconds() {
        return ttl.getSeconds();
    }
}
