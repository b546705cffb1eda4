package com.bastion.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Account quota as reported by a provider's own usage endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaStatus {

    private long used;
    private long limit;

    @JsonProperty("remaining")
    public long remaining() {
        return Math.max(0, limit - used);
    }
}
