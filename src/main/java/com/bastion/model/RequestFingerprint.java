package com.bastion.model;

import lombok.Value;

/**
 * Digest of the cache-relevant subset of a request. Two requests with equal fingerprints
 * are served from the same cache entry.
 */
@Value
public class RequestFingerprint {

    OperationKind operation;
    String model;
    String digest;

    /**
     * Key inside the route's namespace: {@code <operation>:<model>:<sha256>}.
     */
    public String cacheKey() {
        return operation.keyPrefix() + ":" + model + ":" + digest;
    }
}
