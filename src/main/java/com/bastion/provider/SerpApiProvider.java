package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.model.ProviderCategory;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.model.SearchResult;
import com.bastion.resilience.QuotaStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * SerpApi (serpapi.com), the secondary SERP provider. Its quota comes from {@code account.json}.
 */
@Slf4j
@Component
public class SerpApiProvider extends AbstractProvider<SearchRequest, JsonNode, SearchResponse> {

    public static final String NAME = "serpapi";
    private static final String DEFAULT_BASE_URL = "https://serpapi.com";

    // search type → Google tbm parameter
    private static final Map<String, String> TBM = Map.of(
            "news", "nws",
            "images", "isch",
            "videos", "vid",
            "places", "lcl"
    );

    public SerpApiProvider(WebClient webClient, BastionProperties properties) {
        super(webClient, properties, NAME);
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.SEARCH;
    }

    @Override
    protected Mono<JsonNode> send(SearchRequest request) {
        log.info("Forwarding search to SerpApi: type={}, gl={}", request.typeOrDefault(), request.countryOrDefault());

        return webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/search.json", builder -> searchUri(builder, request))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    private URI searchUri(UriBuilder builder, SearchRequest request) {
        builder.queryParam("engine", "google")
                .queryParam("q", request.getQuery())
                .queryParam("gl", request.countryOrDefault())
                .queryParam("hl", request.languageOrDefault())
                .queryParam("num", request.numOrDefault())
                .queryParam("device", request.deviceOrDefault())
                .queryParam("api_key", config.getApiKey());
        if (request.getLocation() != null) {
            builder.queryParam("location", request.getLocation());
        }
        String tbm = TBM.get(request.typeOrDefault());
        if (tbm != null) {
            builder.queryParam("tbm", tbm);
        }
        return builder.build();
    }

    @Override
    public SearchResponse toNormalizedForm(JsonNode response) {
        List<SearchResult> results = SerpParsing.organicResults(response.get("organic_results"), "link");
        return SearchResponse.builder()
                .query(response.path("search_parameters").path("q").asText(null))
                .totalResults(response.path("search_information").path("total_results").asLong(results.size()))
                .results(results)
                .relatedQueries(SerpParsing.texts(response.get("related_searches"), "query"))
                .peopleAlsoAsk(SerpParsing.texts(response.get("related_questions"), "question"))
                .build();
    }

    @Override
    public Mono<QuotaStatus> probeQuota() {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return translateErrors(webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/account.json", builder -> builder
                        .queryParam("api_key", config.getApiKey())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(account -> QuotaStatus.builder()
                        .used(account.path("this_month_usage").asLong())
                        .limit(account.path("searches_per_month").asLong())
                        .build()));
    }
}
