package com.bastion.service;

import com.bastion.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Process-wide cache counters, shared by every response cache and broken down per namespace.
 * Reset only on an explicit clear.
 */
@Slf4j
public class CacheStatisticsRecorder {

    private final Clock clock;
    private final Map<String, Counters> byNamespace = new TreeMap<>();
    private Instant since;

    public CacheStatisticsRecorder(Clock clock) {
        this.clock = clock;
        this.since = clock.instant();
    }

    public synchronized void recordHit(String namespace, BigDecimal savings, long unitsServed) {
        Counters counters = countersFor(namespace);
        counters.hits++;
        counters.savings = counters.savings.add(savings);
        counters.unitsServed += unitsServed;
    }

    public synchronized void recordMiss(String namespace, BigDecimal spent) {
        Counters counters = countersFor(namespace);
        counters.misses++;
        counters.spent = counters.spent.add(spent);
    }

    public synchronized CacheStatistics snapshot() {
        Counters total = new Counters();
        List<CacheStatistics.NamespaceStatistics> namespaces = new ArrayList<>();
        byNamespace.forEach((namespace, counters) -> {
            total.hits += counters.hits;
            total.misses += counters.misses;
            total.savings = total.savings.add(counters.savings);
            total.spent = total.spent.add(counters.spent);
            total.unitsServed += counters.unitsServed;
            namespaces.add(CacheStatistics.NamespaceStatistics.builder()
                    .namespace(namespace)
                    .hits(counters.hits)
                    .misses(counters.misses)
                    .hitRate(counters.hitRate())
                    .totalSavings(counters.savings)
                    .totalSpent(counters.spent)
                    .unitsServed(counters.unitsServed)
                    .build());
        });
        return CacheStatistics.builder()
                .hits(total.hits)
                .misses(total.misses)
                .hitRate(total.hitRate())
                .totalSavings(total.savings)
                .totalSpent(total.spent)
                .unitsServed(total.unitsServed)
                .since(since)
                .byNamespace(namespaces)
                .build();
    }

    public synchronized void reset() {
        byNamespace.clear();
        since = clock.instant();
        log.info("Cache statistics reset");
    }

    private Counters countersFor(String namespace) {
        return byNamespace.computeIfAbsent(namespace, ns -> new Counters());
    }

    private static final class Counters {
        private long hits;
        private long misses;
        private BigDecimal savings = BigDecimal.ZERO;
        private BigDecimal spent = BigDecimal.ZERO;
        private long unitsServed;

        private double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
