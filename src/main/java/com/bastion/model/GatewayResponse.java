package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Envelope around a normalized provider answer with its provenance.
 *
 * @param <T> normalized response type of the route
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse<T> {

    private T data;

    /**
     * Provider that produced {@link #data}, possibly long ago when served from cache.
     */
    private String provider;

    /**
     * Whether the secondary provider served the request.
     */
    private boolean fallback;

    private boolean cached;

    /**
     * When the upstream answer was produced. Preserved on cache hits so callers can judge staleness.
     */
    private Instant createdAt;

    private String cacheKey;

    private BigDecimal costEstimate;
}
