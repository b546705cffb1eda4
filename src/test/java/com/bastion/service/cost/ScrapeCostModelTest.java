package com.bastion.service.cost;

import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScrapeCostModel.
 */
class ScrapeCostModelTest {

    private final ScrapeCostModel costModel = new ScrapeCostModel();

    @Test
    void testSurchargesAddUp() {
        ScrapeRequest request = ScrapeRequest.builder()
                .url("https://example.com")
                .screenshot(true)
                .extractionPrompt("List the product names")
                .build();

        assertEquals(0, new BigDecimal("0.016").compareTo(costModel.estimate(request)));
        assertEquals(0, ScrapeCostModel.BASIC_SCRAPE.compareTo(
                costModel.estimate(ScrapeRequest.builder().url("https://example.com").build())));
    }

    @Test
    void testLargePagesCostMore() {
        ScrapeRequest request = ScrapeRequest.builder().url("https://example.com").build();
        ScrapeResult small = ScrapeResult.builder().markdown("short").build();
        ScrapeResult large = ScrapeResult.builder().markdown("x".repeat(100_001)).build();

        assertEquals(0, new BigDecimal("0.001").compareTo(costModel.actual(request, small)));
        assertEquals(0, new BigDecimal("0.0015").compareTo(costModel.actual(request, large)));
        assertEquals(100_001, costModel.unitsServed(large));
    }
}
