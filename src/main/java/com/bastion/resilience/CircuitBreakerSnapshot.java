package com.bastion.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CircuitBreakerSnapshot {
    String name;
    CircuitState state;
    int consecutiveFailures;
    Instant lastFailureTime;
}
