package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Normalized form of every scraping provider's answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrapeResult {
    private String url;
    private String title;
    private String description;
    private String markdown;
    private String html;
    private List<String> links;
    private String screenshot;
    private Map<String, Object> extraction;
    private Integer statusCode;

    /**
     * Size in bytes of the textual content carried by this result.
     */
    public long contentSize() {
        long size = 0;
        if (markdown != null) {
            size += markdown.length();
        }
        if (html != null) {
            size += html.length();
        }
        if (screenshot != null) {
            size += screenshot.length();
        }
        return size;
    }
}
