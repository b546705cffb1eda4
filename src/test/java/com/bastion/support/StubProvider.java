package com.bastion.support;

import com.bastion.model.ProviderCategory;
import com.bastion.provider.ProviderAdapter;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider adapter with scripted behavior that counts its calls.
 */
public class StubProvider<Q, P, N> implements ProviderAdapter<Q, P, N> {

    private final String name;
    private final ProviderCategory category;
    private final Function<Q, Mono<P>> behavior;
    private final Function<P, N> normalizer;
    private final AtomicInteger calls = new AtomicInteger();
    private boolean enabled = true;

    public StubProvider(String name, ProviderCategory category, Function<Q, Mono<P>> behavior,
                        Function<P, N> normalizer) {
        this.name = name;
        this.category = category;
        this.behavior = behavior;
        this.normalizer = normalizer;
    }

    public static <Q, N> StubProvider<Q, N, N> returning(String name, ProviderCategory category, N value) {
        return new StubProvider<>(name, category, request -> Mono.just(value), Function.identity());
    }

    public static <Q, N> StubProvider<Q, N, N> failing(String name, ProviderCategory category, Throwable error) {
        return new StubProvider<>(name, category, request -> Mono.error(error), Function.identity());
    }

    public int calls() {
        return calls.get();
    }

    public StubProvider<Q, P, N> disabled() {
        this.enabled = false;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ProviderCategory getCategory() {
        return category;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<P> call(Q request) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            return behavior.apply(request);
        });
    }

    @Override
    public N toNormalizedForm(P response) {
        return normalizer.apply(response);
    }
}
