package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.model.ProviderCategory;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.bastion.resilience.QuotaStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ScrapingBee HTML API, the secondary scraping provider. It answers with raw HTML, which is
 * parsed into the scrape shape; the text content stands in for markdown.
 */
@Slf4j
@Component
public class ScrapingBeeProvider extends AbstractProvider<ScrapeRequest, ScrapingBeeProvider.Page, ScrapeResult> {

    public static final String NAME = "scrapingbee";
    private static final String DEFAULT_BASE_URL = "https://app.scrapingbee.com/api/v1";

    public ScrapingBeeProvider(WebClient webClient, BastionProperties properties) {
        super(webClient, properties, NAME);
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.SCRAPE;
    }

    @Override
    protected Mono<Page> send(ScrapeRequest request) {
        log.info("Forwarding scrape to ScrapingBee: url={}", request.getUrl());

        return webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/", builder -> {
                    builder.queryParam("api_key", config.getApiKey())
                            .queryParam("url", request.getUrl())
                            .queryParam("render_js", request.getWaitFor() != null && request.getWaitFor() > 0);
                    if (request.getWaitFor() != null && request.getWaitFor() > 0) {
                        builder.queryParam("wait", request.getWaitFor());
                    }
                    return builder.build();
                })
                .retrieve()
                .toEntity(String.class)
                .map(entity -> new Page(request.getUrl(), entity.getStatusCode().value(), entity.getBody()));
    }

    @Override
    public ScrapeResult toNormalizedForm(Page page) {
        Document doc = Jsoup.parse(page.getHtml() == null ? "" : page.getHtml(), page.getUrl());

        Element description = doc.selectFirst("meta[name=description]");
        List<String> links = doc.select("a[href]").stream()
                .map(a -> a.absUrl("href"))
                .filter(href -> !href.isEmpty())
                .distinct()
                .collect(Collectors.toList());

        doc.select("script,noscript,style,header,footer,nav,aside").remove();
        Elements bodies = doc.select("article, main, #content, .post, .entry-content, .article, .content");
        if (bodies.isEmpty()) {
            bodies = doc.body().children();
        }
        String text = bodies.stream()
                .map(Element::text)
                .collect(Collectors.joining("\n"))
                .replace("\u00A0", " ")
                .replaceAll("[ \\t]{2,}", " ")
                .trim();

        return ScrapeResult.builder()
                .url(page.getUrl())
                .title(doc.title().isEmpty() ? null : doc.title())
                .description(description != null ? description.attr("content") : null)
                .markdown(text)
                .html(page.getHtml())
                .links(links)
                .statusCode(page.getStatusCode())
                .build();
    }

    @Override
    public Mono<QuotaStatus> probeQuota() {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return translateErrors(webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/usage", builder -> builder
                        .queryParam("api_key", config.getApiKey())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(usage -> QuotaStatus.builder()
                        .used(usage.path("used_api_credit").asLong())
                        .limit(usage.path("max_api_credit").asLong())
                        .build()));
    }

    /**
     * Raw page as returned by ScrapingBee.
     */
    @Data
    @AllArgsConstructor
    public static class Page {
        private String url;
        private int statusCode;
        private String html;
    }
}
