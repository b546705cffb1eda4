package com.bastion.provider;

import com.bastion.model.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON helpers shared by the SERP adapters.
 */
final class SerpParsing {

    private SerpParsing() {
    }

    static List<SearchResult> organicResults(JsonNode organic, String linkField) {
        List<SearchResult> results = new ArrayList<>();
        if (organic == null || !organic.isArray()) {
            return results;
        }
        int fallbackPosition = 1;
        for (JsonNode item : organic) {
            String url = item.path(linkField).asText(null);
            results.add(SearchResult.builder()
                    .title(item.path("title").asText(null))
                    .url(url)
                    .snippet(item.path("snippet").asText(null))
                    .position(item.path("position").asInt(fallbackPosition))
                    .domain(domainOf(url))
                    .date(item.path("date").asText(null))
                    .build());
            fallbackPosition++;
        }
        return results;
    }

    static List<String> texts(JsonNode array, String field) {
        List<String> texts = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return texts;
        }
        for (JsonNode item : array) {
            String text = item.path(field).asText(null);
            if (text != null) {
                texts.add(text);
            }
        }
        return texts;
    }

    static String domainOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = URI.create(url).getHost();
            return host != null && host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
