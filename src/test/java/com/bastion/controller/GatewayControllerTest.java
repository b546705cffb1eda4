package com.bastion.controller;

import com.bastion.exception.NoProvidersAvailableException;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.exception.RateLimitedException;
import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.GatewayResponse;
import com.bastion.model.OperationKind;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.model.dto.CacheStatistics;
import com.bastion.model.dto.InvalidationRequest;
import com.bastion.model.dto.InvalidationResult;
import com.bastion.service.Gateway;
import com.bastion.service.GatewayAdminService;
import com.bastion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the HTTP surface: GatewayController, CacheController and ApiExceptionHandler.
 */
class GatewayControllerTest {

    private Gateway<ChatCompletionRequest, ChatCompletionResponse> llmGateway;
    private Gateway<SearchRequest, SearchResponse> searchGateway;
    private Gateway<ScrapeRequest, ScrapeResult> scrapeGateway;
    private GatewayAdminService adminService;
    private MutableClock clock;
    private WebTestClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        llmGateway = mock(Gateway.class);
        searchGateway = mock(Gateway.class);
        scrapeGateway = mock(Gateway.class);
        adminService = mock(GatewayAdminService.class);
        clock = MutableClock.atEpoch();
        clock.advance(Duration.ofDays(1));

        client = WebTestClient.bindToController(
                        new GatewayController(llmGateway, searchGateway, scrapeGateway, clock),
                        new CacheController(adminService),
                        new ProviderController(adminService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testCachedSearchCarriesProvenanceHeaders() {
        GatewayResponse<SearchResponse> cached = GatewayResponse.<SearchResponse>builder()
                .data(SearchResponse.builder().query("loom").results(List.of()).build())
                .provider("serper")
                .cached(true)
                .createdAt(clock.instant().minus(Duration.ofMinutes(2)))
                .build();
        when(searchGateway.execute(any(), eq(OperationKind.KEYWORD_RESEARCH))).thenReturn(Mono.just(cached));

        client.post().uri("/v1/search?operation=keyword-research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"loom\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "true")
                .expectHeader().valueEquals("x-provider", "serper")
                .expectHeader().valueEquals("x-fallback", "false")
                .expectHeader().valueEquals("x-cache-age", "120")
                .expectBody()
                .jsonPath("$.data.query").isEqualTo("loom")
                .jsonPath("$.cached").isEqualTo(true);
    }

    @Test
    void testFreshCompletionHasNoCacheAge() {
        GatewayResponse<ChatCompletionResponse> fresh = GatewayResponse.<ChatCompletionResponse>builder()
                .data(ChatCompletionResponse.builder().id("chatcmpl-1").build())
                .provider("anthropic")
                .fallback(true)
                .createdAt(clock.instant())
                .build();
        when(llmGateway.execute(any(), eq(OperationKind.CONTENT_GENERATION))).thenReturn(Mono.just(fresh));

        client.post().uri("/v1/llm/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "false")
                .expectHeader().valueEquals("x-fallback", "true")
                .expectHeader().doesNotExist("x-cache-age")
                .expectBody()
                .jsonPath("$.data.id").isEqualTo("chatcmpl-1");
    }

    @Test
    void testEmptyMessagesAreRejected() {
        client.post().uri("/v1/llm/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST");

        verify(llmGateway, never()).execute(any(), any());
    }

    @Test
    void testUnknownOperationIsBadRequest() {
        client.post().uri("/v1/scrape?operation=summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"url\":\"https://example.com\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void testNoProvidersIsServiceUnavailable() {
        NoProvidersAvailableException error = new NoProvidersAvailableException("search", List.of("serper", "serpapi"),
                List.of(new ProviderException("serper", ProviderErrorType.UPSTREAM, "HTTP 500"),
                        new ProviderException("serpapi", ProviderErrorType.TIMEOUT, "timed out")));
        when(searchGateway.execute(any(), any())).thenReturn(Mono.error(error));

        client.post().uri("/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"loom\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.code").isEqualTo("NO_PROVIDERS_AVAILABLE")
                .jsonPath("$.attemptedProviders[1]").isEqualTo("serpapi");
    }

    @Test
    void testRateLimitedCarriesRetryAfter() {
        when(scrapeGateway.execute(any(), any())).thenReturn(Mono.error(new RateLimitedException("firecrawl", 1500)));

        client.post().uri("/v1/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"url\":\"https://example.com\"}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "2");
    }

    @Test
    void testInvalidProviderRequestIsBadRequest() {
        when(scrapeGateway.execute(any(), any())).thenReturn(Mono.error(
                new ProviderException("firecrawl", ProviderErrorType.INVALID_REQUEST, 422, "HTTP 422", null)));

        client.post().uri("/v1/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"url\":\"https://example.com\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_REQUEST");
    }

    @Test
    void testCacheStatsAndInvalidation() {
        when(adminService.getStatistics()).thenReturn(CacheStatistics.builder()
                .hits(3).misses(1).hitRate(0.75).totalSavings(new BigDecimal("0.03")).since(Instant.EPOCH)
                .byNamespace(List.of()).build());
        when(adminService.invalidate(any(InvalidationRequest.class))).thenReturn(Mono.just(
                InvalidationResult.builder().scope("namespace:serp").removed(4).build()));

        client.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hits").isEqualTo(3)
                .jsonPath("$.hitRate").isEqualTo(0.75);

        client.post().uri("/v1/cache/invalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"namespace\":\"serp\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(4);
    }
}
