package com.bastion.service.canonicalization;

import com.bastion.config.JacksonConfiguration;
import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.Message;
import com.bastion.model.OperationKind;
import com.bastion.model.RequestFingerprint;
import com.bastion.model.ScrapeRequest;
import com.bastion.model.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestFingerprinter.
 */
class RequestFingerprinterTest {

    private RequestFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new RequestFingerprinter(JacksonConfiguration.createObjectMapper());
    }

    @Test
    void testCacheKeyLayout() {
        RequestFingerprint fingerprint = fingerprinter.fingerprint(chat("Hello, world!"), OperationKind.TRANSLATION);

        String key = fingerprint.cacheKey();
        assertTrue(key.startsWith("translation:gpt-4:"), key);
        assertEquals(64, fingerprint.getDigest().length());
    }

    @Test
    void testExplicitDefaultsMatchOmittedParameters() {
        ChatCompletionRequest omitted = chat("Explain backpressure");
        ChatCompletionRequest explicit = omitted.toBuilder()
                .temperature(1.0)
                .topP(1.0)
                .n(1)
                .presencePenalty(0.0)
                .frequencyPenalty(0.0)
                .build();

        assertEquals(digest(omitted), digest(explicit));
    }

    @Test
    void testWhitespaceAndRoundingDoNotChangeDigest() {
        ChatCompletionRequest a = chat("Explain   backpressure\n").toBuilder().temperature(0.7).build();
        ChatCompletionRequest b = chat("  Explain backpressure").toBuilder().temperature(0.701).build();

        assertEquals(digest(a), digest(b));
    }

    @Test
    void testIrrelevantFieldsAreIgnored() {
        ChatCompletionRequest a = chat("Explain backpressure").toBuilder().user("alice").build();
        ChatCompletionRequest b = chat("Explain backpressure").toBuilder().user("bob").stream(false).build();

        assertEquals(digest(a), digest(b));
    }

    @Test
    void testMeaningfulChangesChangeDigest() {
        ChatCompletionRequest base = chat("Explain backpressure");

        assertNotEquals(digest(base), digest(chat("Explain back pressure")));
        assertNotEquals(digest(base), digest(base.toBuilder().temperature(0.2).build()));
        assertNotEquals(digest(base), digest(base.toBuilder().maxTokens(100).build()));
    }

    @Test
    void testCanonicalFormIsSortedWithoutNulls() {
        String canonical = fingerprinter.canonicalize(SearchRequest.builder().query("Java").num(20).build());

        assertEquals("{\"device\":\"desktop\",\"gl\":\"us\",\"hl\":\"en\",\"num\":20,\"query\":\"java\",\"type\":\"search\"}",
                canonical);
    }

    @Test
    void testScrapeUrlsAreNormalized() {
        ScrapeRequest a = ScrapeRequest.builder().url("https://Example.com/post?utm_campaign=x&id=7#top").build();
        ScrapeRequest b = ScrapeRequest.builder().url("https://example.com/post?id=7").formats(List.of("markdown")).build();

        assertEquals(fingerprinter.fingerprint(a, OperationKind.CONTENT_SCRAPING).cacheKey(),
                fingerprinter.fingerprint(b, OperationKind.CONTENT_SCRAPING).cacheKey());
    }

    @Test
    void testMissingModelUsesDefaultSegment() {
        ChatCompletionRequest request = chat("hi").toBuilder().model(null).build();

        assertTrue(fingerprinter.fingerprint(request, OperationKind.CONTENT_GENERATION).cacheKey()
                .startsWith("content_generation:default:"));
    }

    private String digest(ChatCompletionRequest request) {
        return fingerprinter.fingerprint(request, OperationKind.CONTENT_GENERATION).getDigest();
    }

    private static ChatCompletionRequest chat(String content) {
        return ChatCompletionRequest.builder()
                .model("gpt-4")
                .messages(List.of(Message.user(content)))
                .build();
    }
}
