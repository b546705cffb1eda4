package com.bastion.provider;

import com.bastion.model.ProviderCategory;
import com.bastion.resilience.QuotaStatus;
import reactor.core.publisher.Mono;

/**
 * One external provider of a category.
 * Implementations handle provider-specific authentication, request mapping and API
 * communication, and convert the provider's own response shape into the route's
 * normalized form.
 *
 * @param <Q> request type of the route
 * @param <P> provider-native response type
 * @param <N> normalized response type of the route
 */
public interface ProviderAdapter<Q, P, N> {

    /**
     * Provider id (e.g., "openai", "serper", "firecrawl").
     */
    String getName();

    ProviderCategory getCategory();

    /**
     * Check if provider is enabled and configured.
     */
    boolean isEnabled();

    /**
     * Call the provider once. Failures surface as {@link com.bastion.exception.ProviderException}.
     */
    Mono<P> call(Q request);

    N toNormalizedForm(P response);

    /**
     * Current account quota from the provider's usage endpoint. Empty when unsupported.
     */
    default Mono<QuotaStatus> probeQuota() {
        return Mono.empty();
    }
}
