package com.bastion.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;

/**
 * Closed set of gateway operations. Each kind belongs to one provider category and carries
 * a default cache policy reflecting how fast its answers go stale.
 */
public enum OperationKind {

    CONTENT_GENERATION(ProviderCategory.LLM, policy(Duration.ofDays(7), 4000, "0.01")),
    QUALITY_ANALYSIS(ProviderCategory.LLM, policy(Duration.ofDays(30), 2000, "0.005")),
    FACT_VERIFICATION(ProviderCategory.LLM, policy(Duration.ofDays(1), 1000, "0.002")),
    CODE_GENERATION(ProviderCategory.LLM, policy(Duration.ofDays(14), 3000, "0.01")),
    TRANSLATION(ProviderCategory.LLM, policy(Duration.ofDays(90), 2000, "0.001")),

    SERP_ANALYSIS(ProviderCategory.SEARCH, policy(Duration.ofDays(1), 100, "0.0005")),
    KEYWORD_RESEARCH(ProviderCategory.SEARCH, policy(Duration.ofDays(7), 100, "0.0005")),

    CONTENT_SCRAPING(ProviderCategory.SCRAPE, policy(Duration.ofDays(7), 1024 * 1024, "0.001").toBuilder()
            .excludedUrlPattern("*/api/*")
            .excludedUrlPattern("*/admin/*")
            .excludedUrlPattern("*/dynamic/*")
            .build()),
    COMPETITOR_ANALYSIS(ProviderCategory.SCRAPE, policy(Duration.ofDays(3), 2 * 1024 * 1024, "0.001").toBuilder()
            .excludedUrlPattern("*/search*")
            .excludedUrlPattern("*/results*")
            .includeDynamic(true)
            .build()),
    LINK_ANALYSIS(ProviderCategory.SCRAPE, policy(Duration.ofDays(14), 256 * 1024, "0.001")),
    SCREENSHOT_CAPTURE(ProviderCategory.SCRAPE, policy(Duration.ofDays(1), 5 * 1024 * 1024, "0.005").toBuilder()
            .includeDynamic(true)
            .build());

    private final ProviderCategory category;
    private final OperationPolicy defaultPolicy;

    OperationKind(ProviderCategory category, OperationPolicy defaultPolicy) {
        this.category = category;
        this.defaultPolicy = defaultPolicy;
    }

    public ProviderCategory getCategory() {
        return category;
    }

    public OperationPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Lower-case form used inside cache keys.
     */
    public String keyPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup accepting {@code content-generation}, {@code content_generation} or the constant name.
     *
     * @throws IllegalArgumentException for unknown kinds
     */
    public static OperationKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation kind must be specified");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (OperationKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + value);
    }

    private static OperationPolicy policy(Duration ttl, long maxOutputSize, String costThreshold) {
        return OperationPolicy.builder()
                .enabled(true)
                .ttl(ttl)
                .maxOutputSize(maxOutputSize)
                .costThreshold(new BigDecimal(costThreshold))
                .build();
    }
}
