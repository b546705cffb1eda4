package com.bastion.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache invalidation scope: a key pattern within a namespace, a whole namespace, or
 * everything when no namespace is given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRequest {

    private String namespace;

    /**
     * Key pattern with {@code *} wildcards. Without a wildcard it matches as a prefix.
     */
    private String pattern;
}
