package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stored cache entry. The value is kept as a JSON tree so stores stay agnostic of the
 * normalized response type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private String key;

    private String namespace;

    private OperationKind operation;

    private String provider;

    private JsonNode value;

    private long ttlSeconds;

    private Instant createdAt;

    private BigDecimal costEstimate;

    /**
     * Tokens, results or bytes this entry answers with.
     */
    private long unitsServed;

    @JsonIgnore
    public Instant getExpiresAt() {
        return createdAt.plusSeconds(ttlSeconds);
    }

    /**
     * True once {@code createdAt + ttlSeconds} has been reached.
     */
    public boolean expiredAt(Instant now) {
        return !now.isBefore(getExpiresAt());
    }
}
