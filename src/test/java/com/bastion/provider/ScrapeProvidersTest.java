package com.bastion.provider;

import com.bastion.config.JacksonConfiguration;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Firecrawl and ScrapingBee adapters.
 */
class ScrapeProvidersTest {

    private static final String PAGE = "<html><head><title>Pricing</title>"
            + "<meta name=\"description\" content=\"Plans and prices\"></head>"
            + "<body><nav><a href=\"/home\">Home</a></nav>"
            + "<main><h1>Plans</h1><p>Pro   costs $10.</p><a href=\"/signup\">Sign up</a></main>"
            + "<footer>Legal</footer><script>track()</script></body></html>";

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    @Test
    void testFirecrawlRequestBody() {
        FirecrawlProvider provider = firecrawl(ProviderTestSupport.json(HttpStatus.OK, "{}"));
        ScrapeRequest request = ScrapeRequest.builder()
                .url("https://example.com/pricing")
                .formats(List.of("markdown", "links"))
                .screenshot(true)
                .extractionPrompt("List the plans")
                .waitFor(500)
                .build();

        JsonNode body = provider.toFirecrawlRequest(request);

        assertEquals("https://example.com/pricing", body.get("url").asText());
        assertEquals(4, body.get("formats").size());
        assertEquals("screenshot", body.get("formats").get(2).asText());
        assertEquals("List the plans", body.get("extract").get("prompt").asText());
        assertTrue(body.get("onlyMainContent").asBoolean());
        assertEquals(500, body.get("waitFor").asInt());
    }

    @Test
    void testFirecrawlNormalization() {
        ProviderTestSupport upstream = ProviderTestSupport.json(HttpStatus.OK, "{\"success\":true,\"data\":{"
                + "\"markdown\":\"# Plans\",\"links\":[\"https://example.com/signup\"],"
                + "\"extract\":{\"plans\":[\"Pro\"]},"
                + "\"metadata\":{\"title\":\"Pricing\",\"sourceURL\":\"https://example.com/pricing\",\"statusCode\":200}}}");
        FirecrawlProvider provider = firecrawl(upstream);

        StepVerifier.create(provider.call(ScrapeRequest.builder().url("https://example.com/pricing").build())
                        .map(provider::toNormalizedForm))
                .assertNext(result -> {
                    assertEquals("# Plans", result.getMarkdown());
                    assertEquals("Pricing", result.getTitle());
                    assertEquals(200, result.getStatusCode());
                    assertEquals(List.of("https://example.com/signup"), result.getLinks());
                    assertEquals(List.of("Pro"), result.getExtraction().get("plans"));
                    assertNull(result.getHtml());
                })
                .verifyComplete();
        assertEquals("Bearer fc-key", upstream.requests().get(0).headers().getFirst("Authorization"));
    }

    @Test
    void testFirecrawlUnsuccessfulScrapeIsUpstreamError() throws Exception {
        FirecrawlProvider provider = firecrawl(ProviderTestSupport.json(HttpStatus.OK, "{}"));
        JsonNode failed = objectMapper.readTree("{\"success\":false,\"error\":\"blocked by robots.txt\"}");

        ProviderException error = assertThrows(ProviderException.class, () -> provider.toNormalizedForm(failed));
        assertEquals(ProviderErrorType.UPSTREAM, error.getType());
        assertTrue(error.getMessage().contains("robots.txt"));
    }

    @Test
    void testFirecrawlQuotaReportsRemainingCredits() {
        FirecrawlProvider provider = firecrawl(ProviderTestSupport.json(HttpStatus.OK,
                "{\"success\":true,\"data\":{\"remaining_credits\":4200}}"));

        StepVerifier.create(provider.probeQuota())
                .assertNext(quota -> {
                    assertEquals(0, quota.getUsed());
                    assertEquals(4200, quota.remaining());
                })
                .verifyComplete();
    }

    @Test
    void testScrapingBeeExtractsMainContent() {
        ProviderTestSupport upstream = ProviderTestSupport.html(PAGE);
        ScrapingBeeProvider provider = new ScrapingBeeProvider(upstream.webClient(),
                ProviderTestSupport.properties(ScrapingBeeProvider.NAME, "bee-key"));

        ScrapeResult result = provider.call(ScrapeRequest.builder().url("https://example.com/pricing").build())
                .map(provider::toNormalizedForm)
                .block();

        assertNotNull(result);
        assertEquals("Pricing", result.getTitle());
        assertEquals("Plans and prices", result.getDescription());
        assertEquals("Plans Pro costs $10. Sign up", result.getMarkdown());
        assertEquals(List.of("https://example.com/home", "https://example.com/signup"), result.getLinks());
        assertEquals(200, result.getStatusCode());
        assertEquals(PAGE, result.getHtml());

        String url = upstream.requests().get(0).url().toString();
        assertTrue(url.contains("render_js=false"), url);
    }

    @Test
    void testScrapingBeeServerErrorIsUpstream() {
        ProviderTestSupport upstream = ProviderTestSupport.json(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        ScrapingBeeProvider provider = new ScrapingBeeProvider(upstream.webClient(),
                ProviderTestSupport.properties(ScrapingBeeProvider.NAME, "bee-key"));

        StepVerifier.create(provider.call(ScrapeRequest.builder().url("https://example.com").build()))
                .expectErrorSatisfies(error -> {
                    assertEquals(ProviderErrorType.UPSTREAM, ((ProviderException) error).getType());
                    assertEquals(500, ((ProviderException) error).getStatus());
                })
                .verify();
    }

    private FirecrawlProvider firecrawl(ProviderTestSupport upstream) {
        return new FirecrawlProvider(upstream.webClient(),
                ProviderTestSupport.properties(FirecrawlProvider.NAME, "fc-key"), objectMapper);
    }
}
