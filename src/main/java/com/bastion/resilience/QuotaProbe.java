package com.bastion.resilience;

import reactor.core.publisher.Mono;

/**
 * Asks a provider for its current quota. Completes empty when the provider has no usage endpoint.
 */
@FunctionalInterface
public interface QuotaProbe {

    QuotaProbe NONE = Mono::empty;

    Mono<QuotaStatus> probe();
}
