package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.model.ProviderCategory;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.bastion.resilience.QuotaStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Firecrawl v1 scrape API, the primary scraping provider.
 */
@Slf4j
@Component
public class FirecrawlProvider extends AbstractProvider<ScrapeRequest, JsonNode, ScrapeResult> {

    public static final String NAME = "firecrawl";
    private static final String DEFAULT_BASE_URL = "https://api.firecrawl.dev";

    private final ObjectMapper objectMapper;

    public FirecrawlProvider(WebClient webClient, BastionProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.SCRAPE;
    }

    @Override
    protected Mono<JsonNode> send(ScrapeRequest request) {
        log.info("Forwarding scrape to Firecrawl: url={}", request.getUrl());

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/scrape")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(toFirecrawlRequest(request))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    JsonNode toFirecrawlRequest(ScrapeRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", request.getUrl());

        ArrayNode formats = body.putArray("formats");
        List<String> requested = request.getFormats() != null ? request.getFormats() : List.of("markdown");
        requested.forEach(formats::add);
        if (request.wantsScreenshot()) {
            formats.add("screenshot");
        }
        if (request.wantsExtraction()) {
            formats.add("extract");
            body.putObject("extract").put("prompt", request.getExtractionPrompt());
        }

        body.put("onlyMainContent", request.getOnlyMainContent() == null || request.getOnlyMainContent());
        if (request.getIncludeTags() != null) {
            request.getIncludeTags().forEach(body.putArray("includeTags")::add);
        }
        if (request.getExcludeTags() != null) {
            request.getExcludeTags().forEach(body.putArray("excludeTags")::add);
        }
        if (request.getWaitFor() != null && request.getWaitFor() > 0) {
            body.put("waitFor", request.getWaitFor());
        }
        return body;
    }

    @Override
    public ScrapeResult toNormalizedForm(JsonNode response) {
        if (!response.path("success").asBoolean(false)) {
            throw new ProviderException(NAME, ProviderErrorType.UPSTREAM,
                    "scrape unsuccessful: " + response.path("error").asText("unknown error"));
        }
        JsonNode data = response.path("data");
        JsonNode metadata = data.path("metadata");

        List<String> links = null;
        if (data.path("links").isArray()) {
            links = new ArrayList<>();
            for (JsonNode link : data.get("links")) {
                links.add(link.asText());
            }
        }

        Map<String, Object> extraction = null;
        if (data.path("extract").isObject()) {
            extraction = objectMapper.convertValue(data.get("extract"), new TypeReference<Map<String, Object>>() {
            });
        }

        return ScrapeResult.builder()
                .url(metadata.path("sourceURL").asText(null))
                .title(metadata.path("title").asText(null))
                .description(metadata.path("description").asText(null))
                .statusCode(metadata.has("statusCode") ? metadata.get("statusCode").asInt() : null)
                .markdown(data.path("markdown").asText(null))
                .html(data.path("html").asText(null))
                .links(links)
                .screenshot(data.path("screenshot").asText(null))
                .extraction(extraction)
                .build();
    }

    /**
     * Firecrawl only reports the remaining balance, so the limit is the remaining credits.
     */
    @Override
    public Mono<QuotaStatus> probeQuota() {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return translateErrors(webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/team/credit-usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(usage -> QuotaStatus.builder()
                        .used(0)
                        .limit(usage.path("data").path("remaining_credits").asLong())
                        .build()));
    }
}
