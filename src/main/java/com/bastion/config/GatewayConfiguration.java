package com.bastion.config;

import com.bastion.model.CacheableRequest;
import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.ProviderCategory;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.provider.ProviderAdapter;
import com.bastion.repository.CacheStore;
import com.bastion.resilience.ProviderHealthRegistry;
import com.bastion.service.CachePolicies;
import com.bastion.service.CacheStatisticsRecorder;
import com.bastion.service.Gateway;
import com.bastion.service.GatewayAdminService;
import com.bastion.service.GuardedProvider;
import com.bastion.service.ProviderGuards;
import com.bastion.service.RequestOrchestrator;
import com.bastion.service.ResponseCache;
import com.bastion.service.canonicalization.RequestFingerprinter;
import com.bastion.service.cost.CostModel;
import com.bastion.service.cost.ScrapeCostModel;
import com.bastion.service.cost.SearchCostModel;
import com.bastion.service.cost.TokenCostModel;
import com.bastion.telemetry.GatewayEventListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Wires the shared resilience state and one gateway per provider category.
 * Every limiter, breaker and the health registry is a single shared instance.
 */
@Slf4j
@Configuration
public class GatewayConfiguration {

    private final BastionProperties properties;

    public GatewayConfiguration(BastionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler gatewayScheduler() {
        return Schedulers.parallel();
    }

    /**
     * Registers route providers first, primary before secondary, so records list in priority order.
     */
    @Bean
    public ProviderHealthRegistry providerHealthRegistry(List<ProviderAdapter<?, ?, ?>> adapters, Clock clock) {
        ProviderHealthRegistry registry = new ProviderHealthRegistry(
                properties.getHealth().getFailureThreshold(), properties.getHealth().getCooldown(), clock);
        for (ProviderCategory category : ProviderCategory.values()) {
            BastionProperties.RouteConfig route = properties.route(category);
            registerIfPresent(registry, adapters, route.getPrimary());
            registerIfPresent(registry, adapters, route.getSecondary());
        }
        return registry;
    }

    @Bean
    public ProviderGuards providerGuards(Scheduler gatewayScheduler, Clock clock, GatewayEventListener listener) {
        return new ProviderGuards(properties, gatewayScheduler, clock, listener);
    }

    @Bean
    public Gateway<ChatCompletionRequest, ChatCompletionResponse> llmGateway(
            List<ProviderAdapter<?, ?, ?>> adapters, GatewayParts parts) {
        return gateway(ProviderCategory.LLM, adapters, parts, new TokenCostModel());
    }

    @Bean
    public Gateway<SearchRequest, SearchResponse> searchGateway(
            List<ProviderAdapter<?, ?, ?>> adapters, GatewayParts parts) {
        BigDecimal price = properties.provider(properties.route(ProviderCategory.SEARCH).getPrimary()).getPricePerRequest();
        return gateway(ProviderCategory.SEARCH, adapters, parts,
                price != null ? new SearchCostModel(price) : new SearchCostModel());
    }

    @Bean
    public Gateway<ScrapeRequest, ScrapeResult> scrapeGateway(
            List<ProviderAdapter<?, ?, ?>> adapters, GatewayParts parts) {
        return gateway(ProviderCategory.SCRAPE, adapters, parts, new ScrapeCostModel());
    }

    @Bean
    public GatewayParts gatewayParts(CacheStore cacheStore, RequestFingerprinter fingerprinter,
                                     CachePolicies cachePolicies, CacheStatisticsRecorder statistics,
                                     ObjectMapper objectMapper, Clock clock, ProviderHealthRegistry registry,
                                     ProviderGuards guards, GatewayEventListener listener) {
        return new GatewayParts(cacheStore, fingerprinter, cachePolicies, statistics, objectMapper, clock,
                registry, guards, listener);
    }

    @Bean
    public GatewayAdminService gatewayAdminService(List<Gateway<?, ?>> gateways, CacheStore cacheStore,
                                                   CacheStatisticsRecorder statistics,
                                                   ProviderHealthRegistry registry, ProviderGuards guards) {
        return new GatewayAdminService(gateways, cacheStore, statistics, registry, guards);
    }

    private <Q extends CacheableRequest, N> Gateway<Q, N> gateway(
            ProviderCategory category, List<ProviderAdapter<?, ?, ?>> adapters, GatewayParts parts,
            CostModel<Q, N> costModel) {
        BastionProperties.RouteConfig route = properties.route(category);
        String routeName = category.name().toLowerCase(Locale.ROOT);

        GuardedProvider<Q, ?, N> primary = parts.guards.guard(this.<Q, N>adapter(adapters, route.getPrimary(), category));
        GuardedProvider<Q, ?, N> secondary = route.getSecondary() == null ? null
                : parts.guards.guard(this.<Q, N>adapter(adapters, route.getSecondary(), category));

        RequestOrchestrator<Q, N> orchestrator = new RequestOrchestrator<>(routeName, primary, secondary,
                parts.registry, parts.listener, parts.clock);
        ResponseCache<Q, N> cache = new ResponseCache<>(route.namespaceOrDefault(), parts.cacheStore,
                parts.fingerprinter, parts.policies, costModel, parts.statistics, parts.objectMapper,
                parts.clock, parts.listener);

        log.info("Route {}: primary={}, secondary={}, cache namespace={}",
                routeName, route.getPrimary(), route.getSecondary(), cache.getNamespace());
        return new Gateway<>(category, cache, orchestrator);
    }

    @SuppressWarnings("unchecked")
    private <Q, N> ProviderAdapter<Q, Object, N> adapter(List<ProviderAdapter<?, ?, ?>> adapters,
                                                         String name, ProviderCategory category) {
        ProviderAdapter<?, ?, ?> adapter = adapters.stream()
                .filter(candidate -> candidate.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown provider '" + name + "' for route " + category));
        if (adapter.getCategory() != category) {
            throw new IllegalStateException("Provider '" + name + "' serves " + adapter.getCategory()
                    + ", not " + category);
        }
        return (ProviderAdapter<Q, Object, N>) adapter;
    }

    private static void registerIfPresent(ProviderHealthRegistry registry, List<ProviderAdapter<?, ?, ?>> adapters,
                                          String name) {
        if (name == null) {
            return;
        }
        adapters.stream()
                .filter(adapter -> adapter.getName().equals(name))
                .findFirst()
                .ifPresent(adapter -> registry.register(name, adapter::probeQuota));
    }

    /**
     * Collaborators shared by every gateway.
     */
    public static class GatewayParts {
        private final CacheStore cacheStore;
        private final RequestFingerprinter fingerprinter;
        private final CachePolicies policies;
        private final CacheStatisticsRecorder statistics;
        private final ObjectMapper objectMapper;
        private final Clock clock;
        private final ProviderHealthRegistry registry;
        private final ProviderGuards guards;
        private final GatewayEventListener listener;

        GatewayParts(CacheStore cacheStore, RequestFingerprinter fingerprinter, CachePolicies policies,
                     CacheStatisticsRecorder statistics, ObjectMapper objectMapper, Clock clock,
                     ProviderHealthRegistry registry, ProviderGuards guards, GatewayEventListener listener) {
            this.cacheStore = cacheStore;
            this.fingerprinter = fingerprinter;
            this.policies = policies;
            this.statistics = statistics;
            this.objectMapper = objectMapper;
            this.clock = clock;
            this.registry = registry;
            this.guards = guards;
            this.listener = listener;
        }
    }
}
