package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.model.ProviderCategory;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.model.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Serper (google.serper.dev), the primary SERP provider.
 */
@Slf4j
@Component
public class SerperProvider extends AbstractProvider<SearchRequest, JsonNode, SearchResponse> {

    public static final String NAME = "serper";
    private static final String DEFAULT_BASE_URL = "https://google.serper.dev";

    private final ObjectMapper objectMapper;

    public SerperProvider(WebClient webClient, BastionProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.SEARCH;
    }

    @Override
    protected Mono<JsonNode> send(SearchRequest request) {
        log.info("Forwarding search to Serper: type={}, gl={}", request.typeOrDefault(), request.countryOrDefault());

        ObjectNode body = objectMapper.createObjectNode();
        body.put("q", request.getQuery());
        body.put("gl", request.countryOrDefault());
        body.put("hl", request.languageOrDefault());
        body.put("num", request.numOrDefault());
        if (request.getLocation() != null) {
            body.put("location", request.getLocation());
        }

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/" + request.typeOrDefault())
                .header("X-API-KEY", config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    public SearchResponse toNormalizedForm(JsonNode response) {
        List<SearchResult> results = SerpParsing.organicResults(response.get("organic"), "link");
        JsonNode totalNode = response.path("searchInformation").path("totalResults");
        return SearchResponse.builder()
                .query(response.path("searchParameters").path("q").asText(null))
                .totalResults(totalNode.isMissingNode() ? results.size() : totalNode.asLong(results.size()))
                .results(results)
                .relatedQueries(SerpParsing.texts(response.get("relatedSearches"), "query"))
                .peopleAlsoAsk(SerpParsing.texts(response.get("peopleAlsoAsk"), "question"))
                .build();
    }
}
