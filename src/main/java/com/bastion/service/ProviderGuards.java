package com.bastion.service;

import com.bastion.config.BastionProperties;
import com.bastion.provider.ProviderAdapter;
import com.bastion.resilience.CircuitBreaker;
import com.bastion.resilience.RateLimiter;
import com.bastion.telemetry.GatewayEventListener;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds, once per provider, the rate limiter and circuit breaker guarding its calls.
 */
@Slf4j
public class ProviderGuards {

    private final BastionProperties properties;
    private final Scheduler scheduler;
    private final Clock clock;
    private final GatewayEventListener listener;
    private final Map<String, GuardedProvider<?, ?, ?>> guarded = new LinkedHashMap<>();

    public ProviderGuards(BastionProperties properties, Scheduler scheduler, Clock clock,
                          GatewayEventListener listener) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
        this.listener = listener;
    }

    @SuppressWarnings("unchecked")
    public synchronized <Q, P, N> GuardedProvider<Q, P, N> guard(ProviderAdapter<Q, P, N> adapter) {
        return (GuardedProvider<Q, P, N>) guarded.computeIfAbsent(adapter.getName(), name -> {
            BastionProperties.ProviderConfig config = properties.provider(name);
            RateLimiter limiter = new RateLimiter(name, config.getMaxRequests(), config.getWindow(),
                    config.getMaxRetries(), config.getBaseBackoff(), scheduler, listener);
            CircuitBreaker breaker = new CircuitBreaker(name, config.getFailureThreshold(), config.getCooldown(),
                    clock, listener);
            log.info("Guarding provider {}: {} requests/{}, {} retries, breaker threshold {} cooldown {}",
                    name, config.getMaxRequests(), config.getWindow(), config.getMaxRetries(),
                    config.getFailureThreshold(), config.getCooldown());
            return new GuardedProvider<>(adapter, limiter, breaker, config.getTimeout(), scheduler);
        });
    }

    public synchronized List<GuardedProvider<?, ?, ?>> all() {
        return new ArrayList<>(guarded.values());
    }
}
