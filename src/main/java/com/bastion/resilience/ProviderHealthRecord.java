package com.bastion.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class ProviderHealthRecord {
    String providerId;
    boolean available;
    int failureCount;
    Instant lastCheck;
    QuotaStatus quota;
}
