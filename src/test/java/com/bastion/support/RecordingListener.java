package com.bastion.support;

import com.bastion.model.OperationKind;
import com.bastion.resilience.CircuitState;
import com.bastion.telemetry.GatewayEventListener;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event listener that keeps what it was told, one line per event.
 */
public class RecordingListener implements GatewayEventListener {

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    public List<String> events() {
        return new ArrayList<>(events);
    }

    @Override
    public void onAdmissionDelayed(String providerId, long waitMs, int waiting) {
        events.add("delayed:" + providerId + ":" + waitMs);
    }

    @Override
    public void onCircuitTransition(String breakerName, CircuitState from, CircuitState to) {
        events.add("circuit:" + from + "->" + to);
    }

    @Override
    public void onProviderFallback(String route, String primaryId, String secondaryId, Throwable cause) {
        events.add("fallback:" + primaryId + "->" + secondaryId);
    }

    @Override
    public void onProviderServed(String route, String providerId, boolean fallback, long latencyMs) {
        events.add("served:" + providerId + ":" + fallback);
    }

    @Override
    public void onCacheHit(String namespace, String key, OperationKind operation, BigDecimal savings) {
        events.add("hit:" + namespace + ":" + operation);
    }

    @Override
    public void onCacheMiss(String namespace, String key, OperationKind operation, BigDecimal cost) {
        events.add("miss:" + namespace + ":" + operation);
    }
}
