package com.bastion.service;

import com.bastion.config.BastionProperties;
import com.bastion.model.OperationKind;
import com.bastion.model.OperationPolicy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective cache policy per operation kind: the built-in defaults with configured overrides applied.
 */
public class CachePolicies {

    private final Map<OperationKind, OperationPolicy> policies;

    private CachePolicies(Map<OperationKind, OperationPolicy> policies) {
        this.policies = Collections.unmodifiableMap(policies);
    }

    public static CachePolicies defaults() {
        return from(new BastionProperties.CacheConfig());
    }

    public static CachePolicies from(BastionProperties.CacheConfig config) {
        Map<OperationKind, OperationPolicy> policies = new EnumMap<>(OperationKind.class);
        for (OperationKind kind : OperationKind.values()) {
            OperationPolicy policy = apply(kind.getDefaultPolicy(), config.getOperations().get(kind));
            if (!config.isEnabled()) {
                policy = policy.toBuilder().enabled(false).build();
            }
            policies.put(kind, policy);
        }
        return new CachePolicies(policies);
    }

    public OperationPolicy policyFor(OperationKind kind) {
        return policies.get(kind);
    }

    private static OperationPolicy apply(OperationPolicy policy, BastionProperties.OperationOverride override) {
        if (override == null) {
            return policy;
        }
        OperationPolicy.OperationPolicyBuilder builder = policy.toBuilder();
        if (override.getEnabled() != null) {
            builder.enabled(override.getEnabled());
        }
        if (override.getTtl() != null) {
            builder.ttl(override.getTtl());
        }
        if (override.getMaxOutputSize() != null) {
            builder.maxOutputSize(override.getMaxOutputSize());
        }
        if (override.getExcludedModels() != null) {
            builder.clearExcludedModels().excludedModels(override.getExcludedModels());
        }
        if (override.getExcludedUrlPatterns() != null) {
            builder.clearExcludedUrlPatterns().excludedUrlPatterns(override.getExcludedUrlPatterns());
        }
        if (override.getIncludeDynamic() != null) {
            builder.includeDynamic(override.getIncludeDynamic());
        }
        if (override.getCostThreshold() != null) {
            builder.costThreshold(override.getCostThreshold());
        }
        return builder.build();
    }
}
