package com.bastion.service;

import com.bastion.model.CacheableRequest;
import com.bastion.model.GatewayResponse;
import com.bastion.model.OperationKind;
import com.bastion.model.ProviderCategory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Outbound surface of one provider category: cache lookup, orchestration, cache population.
 */
@Slf4j
public class Gateway<Q extends CacheableRequest, N> {

    @Getter
    private final ProviderCategory category;
    @Getter
    private final ResponseCache<Q, N> cache;
    private final RequestOrchestrator<Q, N> orchestrator;

    public Gateway(ProviderCategory category, ResponseCache<Q, N> cache, RequestOrchestrator<Q, N> orchestrator) {
        this.category = category;
        this.cache = cache;
        this.orchestrator = orchestrator;
    }

    /**
     * Serve the request from cache when possible, otherwise from a provider, populating the cache.
     */
    public Mono<GatewayResponse<N>> execute(Q request, OperationKind operation) {
        if (operation.getCategory() != category) {
            return Mono.error(new IllegalArgumentException(
                    "Operation " + operation + " does not belong to the " + category + " gateway"));
        }
        log.debug("Processing {} request: model={}", operation, request.cacheModel());

        return cache.get(request, operation)
                .doOnNext(hit -> log.info("Serving cached {} response from {} (created {})",
                        operation, hit.getProvider(), hit.getCreatedAt()))
                .switchIfEmpty(Mono.defer(() -> orchestrator.execute(request)
                        .flatMap(response -> cache.set(request, response, operation)
                                .thenReturn(response))));
    }
}
