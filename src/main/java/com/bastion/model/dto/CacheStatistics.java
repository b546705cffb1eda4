package com.bastion.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Process-wide cache statistics for the admin endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long hits;

    private long misses;

    /**
     * Cache hit rate (0.0-1.0).
     */
    private double hitRate;

    /**
     * Upstream cost avoided by cache hits, in USD.
     */
    private BigDecimal totalSavings;

    /**
     * Upstream cost of misses that populated the cache, in USD.
     */
    private BigDecimal totalSpent;

    /**
     * Tokens, results or bytes answered from cache.
     */
    private long unitsServed;

    /**
     * When the counters were last reset.
     */
    private Instant since;

    private List<NamespaceStatistics> byNamespace;

    /**
     * Statistics for a single namespace.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NamespaceStatistics {
        private String namespace;
        private long hits;
        private long misses;
        private double hitRate;
        private BigDecimal totalSavings;
        private BigDecimal totalSpent;
        private long unitsServed;
    }
}
