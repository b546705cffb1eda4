package com.bastion.model.dto;

import com.bastion.resilience.CircuitBreakerSnapshot;
import com.bastion.resilience.ProviderHealthRecord;
import com.bastion.resilience.RateLimitWindow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Health of every provider, for the providers endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderHealthReport {

    /**
     * Registry records in priority order, with live quota where the provider reports it.
     */
    private List<ProviderHealthRecord> providers;

    private List<CircuitBreakerSnapshot> circuits;

    private Map<String, RateLimitWindow> admissionWindows;
}
