package com.bastion.controller;

import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.GatewayResponse;
import com.bastion.model.OperationKind;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.service.Gateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Gateway endpoints, one per provider category, with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class GatewayController {

    private final Gateway<ChatCompletionRequest, ChatCompletionResponse> llmGateway;
    private final Gateway<SearchRequest, SearchResponse> searchGateway;
    private final Gateway<ScrapeRequest, ScrapeResult> scrapeGateway;
    private final Clock clock;

    public GatewayController(Gateway<ChatCompletionRequest, ChatCompletionResponse> llmGateway,
                             Gateway<SearchRequest, SearchResponse> searchGateway,
                             Gateway<ScrapeRequest, ScrapeResult> scrapeGateway,
                             Clock clock) {
        this.llmGateway = llmGateway;
        this.searchGateway = searchGateway;
        this.scrapeGateway = scrapeGateway;
        this.clock = clock;
    }

    @PostMapping(value = "/llm/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<GatewayResponse<ChatCompletionResponse>>> complete(
            @RequestBody ChatCompletionRequest request,
            @RequestParam(name = "operation", defaultValue = "content_generation") String operation) {

        log.info("Received completion request: model={}, operation={}", request.getModel(), operation);

        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Messages cannot be empty"));
        }
        if (request.getModel() == null || request.getModel().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Model must be specified"));
        }
        if (request.streaming()) {
            return Mono.error(new IllegalArgumentException("Streaming is not supported by this endpoint"));
        }

        return llmGateway.execute(request, OperationKind.fromString(operation))
                .map(this::withProvenance);
    }

    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<GatewayResponse<SearchResponse>>> search(
            @RequestBody SearchRequest request,
            @RequestParam(name = "operation", defaultValue = "serp_analysis") String operation) {

        log.info("Received search request: type={}, operation={}", request.typeOrDefault(), operation);

        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return Mono.error(new IllegalArgumentException("Query must be specified"));
        }

        return searchGateway.execute(request, OperationKind.fromString(operation))
                .map(this::withProvenance);
    }

    @PostMapping(value = "/scrape", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<GatewayResponse<ScrapeResult>>> scrape(
            @RequestBody ScrapeRequest request,
            @RequestParam(name = "operation", defaultValue = "content_scraping") String operation) {

        log.info("Received scrape request: url={}, operation={}", request.getUrl(), operation);

        if (request.getUrl() == null || request.getUrl().isBlank()) {
            return Mono.error(new IllegalArgumentException("URL must be specified"));
        }

        return scrapeGateway.execute(request, OperationKind.fromString(operation))
                .map(this::withProvenance);
    }

    private <N> ResponseEntity<GatewayResponse<N>> withProvenance(GatewayResponse<N> response) {
        HttpHeaders headers = new HttpHeaders();
        headers.add("x-cache-hit", String.valueOf(response.isCached()));
        if (response.getProvider() != null) {
            headers.add("x-provider", response.getProvider());
        }
        headers.add("x-fallback", String.valueOf(response.isFallback()));
        if (response.isCached() && response.getCreatedAt() != null) {
            long ageSeconds = Duration.between(response.getCreatedAt(), clock.instant()).getSeconds();
            headers.add("x-cache-age", String.valueOf(Math.max(0, ageSeconds)));
        }
        return ResponseEntity.ok()
                .headers(headers)
                .body(response);
    }
}
