package com.bastion.telemetry;

import com.bastion.model.OperationKind;
import com.bastion.resilience.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Writes every gateway event as a key=value structured log line.
 */
@Slf4j
@Component
public class LoggingGatewayEventListener implements GatewayEventListener {

    @Override
    public void onAdmissionDelayed(String providerId, long waitMs, int waiting) {
        log.info("event=admission_delayed provider={} wait_ms={} waiting={}", providerId, waitMs, waiting);
    }

    @Override
    public void onCircuitTransition(String breakerName, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("event=circuit_transition breaker={} from={} to={}", breakerName, from, to);
        } else {
            log.info("event=circuit_transition breaker={} from={} to={}", breakerName, from, to);
        }
    }

    @Override
    public void onProviderFallback(String route, String primaryId, String secondaryId, Throwable cause) {
        log.warn("event=provider_fallback route={} primary={} secondary={} cause={}",
                route, primaryId, secondaryId, cause == null ? "unavailable" : cause.getMessage());
    }

    @Override
    public void onProviderServed(String route, String providerId, boolean fallback, long latencyMs) {
        log.info("event=provider_served route={} provider={} fallback={} latency_ms={}",
                route, providerId, fallback, latencyMs);
    }

    @Override
    public void onCacheHit(String namespace, String key, OperationKind operation, BigDecimal savings) {
        log.debug("event=cache_hit namespace={} key={} operation={} cost_delta=-{}",
                namespace, key, operation, savings);
    }

    @Override
    public void onCacheMiss(String namespace, String key, OperationKind operation, BigDecimal cost) {
        log.debug("event=cache_miss namespace={} key={} operation={} cost_delta=+{}",
                namespace, key, operation, cost);
    }
}
