package com.bastion.service.cost;

import com.bastion.model.ScrapeRequest;
import com.bastion.model.ScrapeResult;

import java.math.BigDecimal;

/**
 * Per-page scrape pricing with surcharges for LLM extraction and screenshots.
 * Large pages cost half again as much.
 */
public class ScrapeCostModel implements CostModel<ScrapeRequest, ScrapeResult> {

    static final BigDecimal BASIC_SCRAPE = new BigDecimal("0.001");
    static final BigDecimal LLM_EXTRACTION = new BigDecimal("0.01");
    static final BigDecimal SCREENSHOT = new BigDecimal("0.005");
    static final long LARGE_CONTENT_CHARS = 100_000;

    private static final BigDecimal LARGE_CONTENT_FACTOR = new BigDecimal("1.5");

    @Override
    public BigDecimal estimate(ScrapeRequest request) {
        BigDecimal cost = BASIC_SCRAPE;
        if (request.wantsExtraction()) {
            cost = cost.add(LLM_EXTRACTION);
        }
        if (request.wantsScreenshot()) {
            cost = cost.add(SCREENSHOT);
        }
        return cost;
    }

    @Override
    public BigDecimal actual(ScrapeRequest request, ScrapeResult response) {
        BigDecimal cost = estimate(request);
        if (response.contentSize() > LARGE_CONTENT_CHARS) {
            cost = cost.multiply(LARGE_CONTENT_FACTOR);
        }
        return cost;
    }

    @Override
    public long unitsServed(ScrapeResult response) {
        return response.contentSize();
    }

    @Override
    public Class<ScrapeResult> responseType() {
        return ScrapeResult.class;
    }
}
