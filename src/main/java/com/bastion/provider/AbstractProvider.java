package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import io.netty.handler.timeout.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Base class for provider adapters with the common WebClient plumbing.
 */
@Slf4j
public abstract class AbstractProvider<Q, P, N> implements ProviderAdapter<Q, P, N> {

    protected final WebClient webClient;
    protected final BastionProperties.ProviderConfig config;
    private final String name;

    protected AbstractProvider(WebClient webClient, BastionProperties properties, String providerName) {
        this.webClient = webClient;
        this.config = properties.getProviders().get(providerName);
        this.name = providerName;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public Mono<P> call(Q request) {
        if (!isEnabled()) {
            return Mono.error(new ProviderException(name, ProviderErrorType.AUTHENTICATION,
                    "provider is not enabled or has no API key"));
        }
        return translateErrors(send(request))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", name))
                .doOnError(error -> log.warn("Request failed for provider {}: {}", name, error.getMessage()));
    }

    /**
     * Performs the HTTP exchange. Raw WebClient errors are translated by the caller.
     */
    protected abstract Mono<P> send(Q request);

    protected <T> Mono<T> translateErrors(Mono<T> exchange) {
        return exchange.onErrorMap(e -> !(e instanceof ProviderException), this::toProviderException);
    }

    /**
     * Maps transport and HTTP failures onto the typed provider error taxonomy.
     */
    protected ProviderException toProviderException(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            return new ProviderException(name, ProviderErrorType.fromStatus(status), status,
                    "HTTP " + status + " " + response.getStatusText(), error);
        }
        if (error instanceof WebClientRequestException) {
            ProviderErrorType type = isTimeout(error.getCause()) ? ProviderErrorType.TIMEOUT : ProviderErrorType.NETWORK;
            return new ProviderException(name, type, null, error.getMessage(), error);
        }
        if (isTimeout(error)) {
            return new ProviderException(name, ProviderErrorType.TIMEOUT, null, "timed out", error);
        }
        if (error instanceof CodecException || error instanceof IllegalStateException) {
            return new ProviderException(name, ProviderErrorType.MALFORMED_RESPONSE, null,
                    "unreadable response: " + error.getMessage(), error);
        }
        return new ProviderException(name, ProviderErrorType.UPSTREAM, null, String.valueOf(error.getMessage()), error);
    }

    private static boolean isTimeout(Throwable error) {
        return error instanceof java.util.concurrent.TimeoutException || error instanceof TimeoutException;
    }

    protected String baseUrl(String defaultBaseUrl) {
        return config.getBaseUrl() != null ? config.getBaseUrl() : defaultBaseUrl;
    }
}
