package com.bastion.config;

import com.bastion.model.OperationKind;
import com.bastion.model.ProviderCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Bastion.
 */
@Data
@Component
@ConfigurationProperties(prefix = "bastion")
public class BastionProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private Map<ProviderCategory, RouteConfig> routes = new EnumMap<>(ProviderCategory.class);
    private HealthConfig health = new HealthConfig();
    private CacheConfig cache = new CacheConfig();

    public ProviderConfig provider(String providerId) {
        return providers.getOrDefault(providerId, new ProviderConfig());
    }

    /**
     * Configured route of a category, or the built-in provider pair when none is configured.
     */
    public RouteConfig route(ProviderCategory category) {
        RouteConfig route = routes.get(category);
        if (route != null && route.getPrimary() != null) {
            return route;
        }
        RouteConfig defaults = new RouteConfig();
        switch (category) {
            case LLM -> {
                defaults.setPrimary("openai");
                defaults.setSecondary("anthropic");
            }
            case SEARCH -> {
                defaults.setPrimary("serper");
                defaults.setSecondary("serpapi");
            }
            case SCRAPE -> {
                defaults.setPrimary("firecrawl");
                defaults.setSecondary("scrapingbee");
            }
        }
        if (route != null) {
            defaults.setCacheNamespace(route.getCacheNamespace());
        }
        return defaults;
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;

        // admission window
        private int maxRequests = 60;
        private Duration window = Duration.ofMinutes(1);
        private int maxRetries = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);

        // circuit breaker
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);

        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Flat price of one request, for providers billed per call. Unset uses the category default.
         */
        private BigDecimal pricePerRequest;
    }

    @Data
    public static class RouteConfig {
        private String primary;
        private String secondary;

        /**
         * Cache namespace of the route. Defaults to the primary provider id.
         */
        private String cacheNamespace;

        public String namespaceOrDefault() {
            return cacheNamespace != null ? cacheNamespace : primary;
        }
    }

    @Data
    public static class HealthConfig {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String store = "memory"; // memory, redis
        private int maxEntries = 10000;
        private Map<OperationKind, OperationOverride> operations = new EnumMap<>(OperationKind.class);
    }

    /**
     * Per-operation overrides of the built-in cache policy. Unset fields keep the default.
     */
    @Data
    public static class OperationOverride {
        private Boolean enabled;
        private Duration ttl;
        private Long maxOutputSize;
        private List<String> excludedModels;
        private List<String> excludedUrlPatterns;
        private Boolean includeDynamic;
        private BigDecimal costThreshold;
    }
}
