package com.bastion.service.canonicalization;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UrlNormalizer.
 */
class UrlNormalizerTest {

    @Test
    void testStripsTrackingParameters() {
        assertEquals("https://example.com/pricing?plan=pro",
                UrlNormalizer.normalize("https://example.com/pricing?utm_source=newsletter&plan=pro&gclid=abc123"));
    }

    @Test
    void testSortsParametersAndDropsFragment() {
        assertEquals("https://example.com/list?a=1&b=2",
                UrlNormalizer.normalize("https://example.com/list?b=2&a=1#section-3"));
    }

    @Test
    void testLowercasesSchemeAndHostButNotPath() {
        assertEquals("https://example.com/Docs/Intro",
                UrlNormalizer.normalize("HTTPS://Example.COM/Docs/Intro"));
    }

    @Test
    void testEmptyPathBecomesSlash() {
        assertEquals("https://example.com/", UrlNormalizer.normalize("https://example.com"));
        assertEquals("https://example.com/", UrlNormalizer.normalize("https://example.com?ref=hn"));
    }

    @Test
    void testUnparseableInputIsReturnedTrimmed() {
        assertEquals("not a url", UrlNormalizer.normalize("  not a url "));
        assertEquals("example.com/page", UrlNormalizer.normalize("example.com/page"));
    }
}
