package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Search-result (SERP) request, the request shape of the search route.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchRequest implements CacheableRequest {

    public static final String DEFAULT_TYPE = "search";
    public static final String DEFAULT_COUNTRY = "us";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_DEVICE = "desktop";
    public static final int DEFAULT_NUM = 10;

    private static final Map<String, Object> DEFAULTS = Map.of(
            "type", DEFAULT_TYPE,
            "gl", DEFAULT_COUNTRY,
            "hl", DEFAULT_LANGUAGE,
            "device", DEFAULT_DEVICE,
            "num", DEFAULT_NUM
    );

    @JsonProperty("query")
    private String query;

    @JsonProperty("type")
    private String type; // search, news, images, places

    @JsonProperty("gl")
    private String country;

    @JsonProperty("hl")
    private String language;

    @JsonProperty("location")
    private String location;

    @JsonProperty("device")
    private String device; // desktop, mobile

    @JsonProperty("num")
    private Integer num;

    public String typeOrDefault() {
        return type == null ? DEFAULT_TYPE : type;
    }

    public String countryOrDefault() {
        return country == null ? DEFAULT_COUNTRY : country;
    }

    public String languageOrDefault() {
        return language == null ? DEFAULT_LANGUAGE : language;
    }

    public String deviceOrDefault() {
        return device == null ? DEFAULT_DEVICE : device;
    }

    public int numOrDefault() {
        return num == null ? DEFAULT_NUM : num;
    }

    @Override
    public String cacheModel() {
        return "serp-" + typeOrDefault();
    }

    @Override
    public boolean streaming() {
        return false;
    }

    @Override
    public long requestedOutputSize() {
        return numOrDefault();
    }

    /**
     * Queries are compared case-insensitively.
     */
    @Override
    public Map<String, Object> fingerprintFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("query", query == null ? null : query.toLowerCase(Locale.ROOT));
        fields.put("type", type);
        fields.put("gl", country);
        fields.put("hl", language);
        fields.put("location", location);
        fields.put("device", device);
        fields.put("num", num);
        return fields;
    }

    @Override
    public Map<String, Object> fingerprintDefaults() {
        return DEFAULTS;
    }
}
