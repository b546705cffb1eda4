package com.bastion.resilience;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks, per logical provider, whether it may currently be tried.
 *
 * <p>This works at the granularity of whole gateway operations, above the per-call
 * {@link CircuitBreaker}. A provider is marked down once its failure count reaches the
 * threshold. Recovery is optimistic: after the cooldown the next {@link #isAvailable} call
 * resets the record without probing the provider, and the next real call decides.
 */
@Slf4j
public class ProviderHealthRegistry {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    // registration order is the declared priority order
    private final Map<String, HealthState> states = new LinkedHashMap<>();
    private final Map<String, QuotaProbe> probes = new LinkedHashMap<>();

    public ProviderHealthRegistry(Clock clock) {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN, clock);
    }

    public ProviderHealthRegistry(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public void register(String providerId) {
        register(providerId, QuotaProbe.NONE);
    }

    public synchronized void register(String providerId, QuotaProbe probe) {
        stateFor(providerId);
        probes.put(providerId, probe);
    }

    public synchronized boolean isAvailable(String providerId) {
        HealthState state = stateFor(providerId);
        if (state.failureCount < failureThreshold) {
            return true;
        }
        Duration sinceLastFailure = Duration.between(state.lastCheck, clock.instant());
        if (sinceLastFailure.compareTo(cooldown) < 0) {
            return false;
        }
        log.info("Provider {} cooldown of {} elapsed, optimistically marking available (was {} failures)",
                providerId, cooldown, state.failureCount);
        state.failureCount = 0;
        state.available = true;
        return true;
    }

    public synchronized void recordFailure(String providerId) {
        HealthState state = stateFor(providerId);
        state.failureCount++;
        state.lastCheck = clock.instant();
        if (state.failureCount >= failureThreshold && state.available) {
            state.available = false;
            log.warn("Provider {} marked unavailable after {} failures", providerId, state.failureCount);
        }
    }

    public synchronized void recordSuccess(String providerId) {
        HealthState state = stateFor(providerId);
        if (!state.available) {
            log.info("Provider {} recovered", providerId);
        }
        state.failureCount = 0;
        state.available = true;
        state.lastCheck = clock.instant();
    }

    public synchronized ProviderHealthRecord getRecord(String providerId) {
        return stateFor(providerId).toRecord(providerId);
    }

    public synchronized List<ProviderHealthRecord> getRecords() {
        List<ProviderHealthRecord> records = new ArrayList<>();
        states.forEach((id, state) -> records.add(state.toRecord(id)));
        return records;
    }

    /**
     * Snapshots every record and augments it with a live quota probe where the provider
     * supports one. Advisory only: probe failures leave the quota empty.
     */
    public Mono<List<ProviderHealthRecord>> checkHealth() {
        List<ProviderHealthRecord> snapshot;
        Map<String, QuotaProbe> probeSnapshot;
        synchronized (this) {
            snapshot = getRecords();
            probeSnapshot = new LinkedHashMap<>(probes);
        }
        return Flux.fromIterable(snapshot)
                .concatMap(record -> probeSnapshot.getOrDefault(record.getProviderId(), QuotaProbe.NONE)
                        .probe()
                        .timeout(PROBE_TIMEOUT)
                        .map(quota -> record.toBuilder().quota(quota).build())
                        .onErrorResume(error -> {
                            log.warn("Quota probe failed for {}: {}", record.getProviderId(), error.getMessage());
                            return Mono.just(record);
                        })
                        .defaultIfEmpty(record))
                .collectList();
    }

    private HealthState stateFor(String providerId) {
        return states.computeIfAbsent(providerId, id -> new HealthState(clock.instant()));
    }

    private static final class HealthState {
        private boolean available = true;
        private int failureCount;
        private Instant lastCheck;

        private HealthState(Instant registeredAt) {
            this.lastCheck = registeredAt;
        }

        private ProviderHealthRecord toRecord(String providerId) {
            return ProviderHealthRecord.builder()
                    .providerId(providerId)
                    .available(available)
                    .failureCount(failureCount)
                    .lastCheck(lastCheck)
                    .build();
        }
    }
}
