package com.bastion.telemetry;

import com.bastion.model.OperationKind;
import com.bastion.resilience.CircuitState;

import java.math.BigDecimal;

/**
 * Observability sink for the resilience and caching layer.
 * All methods have no-op defaults so implementations pick what they record.
 */
public interface GatewayEventListener {

    GatewayEventListener NO_OP = new GatewayEventListener() {
    };

    /**
     * A call was held back because the provider's admission window was full. {@code waiting}
     * counts the callers holding a reservation, this one included.
     */
    default void onAdmissionDelayed(String providerId, long waitMs, int waiting) {
    }

    default void onCircuitTransition(String breakerName, CircuitState from, CircuitState to) {
    }

    /**
     * The primary failed (or was ineligible) and the secondary is being tried.
     */
    default void onProviderFallback(String route, String primaryId, String secondaryId, Throwable cause) {
    }

    default void onProviderServed(String route, String providerId, boolean fallback, long latencyMs) {
    }

    default void onCacheHit(String namespace, String key, OperationKind operation, BigDecimal savings) {
    }

    default void onCacheMiss(String namespace, String key, OperationKind operation, BigDecimal cost) {
    }
}
