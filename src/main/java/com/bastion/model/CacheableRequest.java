package com.bastion.model;

import java.util.Map;

/**
 * What the response cache needs to know about a request before it ever hashes it.
 * Method names avoid bean-style prefixes so Jackson does not serialize them.
 */
public interface CacheableRequest {

    /**
     * Model or provider-operation identifier. Part of the cache key and matched against
     * the operation's exclusion list.
     */
    String cacheModel();

    boolean streaming();

    /**
     * Requested output size in the unit of the category, 0 when the request does not say.
     */
    long requestedOutputSize();

    /**
     * URL the request targets, when it has one.
     */
    default String targetUrl() {
        return null;
    }

    /**
     * Semantically relevant subset of the request. Unset parameters may be absent or null.
     */
    Map<String, Object> fingerprintFields();

    /**
     * Values substituted for absent parameters before hashing, so that an omitted parameter
     * and its explicit default produce the same fingerprint.
     */
    Map<String, Object> fingerprintDefaults();
}
