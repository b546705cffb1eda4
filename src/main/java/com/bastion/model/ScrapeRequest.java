package com.bastion.model;

import com.bastion.service.canonicalization.UrlNormalizer;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web-scraping request, the request shape of the scrape route.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrapeRequest implements CacheableRequest {

    private static final Map<String, Object> DEFAULTS = Map.of(
            "formats", List.of("markdown"),
            "only_main_content", true,
            "wait_for", 0,
            "screenshot", false
    );

    @JsonProperty("url")
    private String url;

    @JsonProperty("formats")
    private List<String> formats; // markdown, html, links

    @JsonProperty("only_main_content")
    private Boolean onlyMainContent;

    @JsonProperty("include_tags")
    private List<String> includeTags;

    @JsonProperty("exclude_tags")
    private List<String> excludeTags;

    @JsonProperty("wait_for")
    private Integer waitFor;

    @JsonProperty("screenshot")
    private Boolean screenshot;

    /**
     * Prompt for LLM-based structured extraction, when requested.
     */
    @JsonProperty("extraction_prompt")
    private String extractionPrompt;

    public boolean wantsScreenshot() {
        return Boolean.TRUE.equals(screenshot);
    }

    public boolean wantsExtraction() {
        return extractionPrompt != null && !extractionPrompt.isBlank();
    }

    @Override
    public String cacheModel() {
        if (wantsExtraction()) {
            return "llm-extraction";
        }
        return wantsScreenshot() ? "screenshot" : "scrape";
    }

    @Override
    public boolean streaming() {
        return false;
    }

    /**
     * A scrape cannot ask for a size; the content size is checked once the page is fetched.
     */
    @Override
    public long requestedOutputSize() {
        return 0;
    }

    @Override
    public String targetUrl() {
        return url;
    }

    @Override
    public Map<String, Object> fingerprintFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("url", url == null ? null : UrlNormalizer.normalize(url));
        fields.put("formats", formats);
        fields.put("only_main_content", onlyMainContent);
        fields.put("include_tags", includeTags);
        fields.put("exclude_tags", excludeTags);
        fields.put("wait_for", waitFor);
        fields.put("screenshot", screenshot);
        fields.put("extraction_prompt", extractionPrompt);
        return fields;
    }

    @Override
    public Map<String, Object> fingerprintDefaults() {
        return DEFAULTS;
    }
}
