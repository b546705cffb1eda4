package com.bastion.service.cost;

import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;

import java.math.BigDecimal;

/**
 * Per-query SERP pricing. Each page of ten results is billed as one query.
 */
public class SearchCostModel implements CostModel<SearchRequest, SearchResponse> {

    public static final BigDecimal DEFAULT_PRICE_PER_QUERY = new BigDecimal("0.001");

    private static final int RESULTS_PER_PAGE = 10;

    private final BigDecimal pricePerQuery;

    public SearchCostModel() {
        this(DEFAULT_PRICE_PER_QUERY);
    }

    public SearchCostModel(BigDecimal pricePerQuery) {
        this.pricePerQuery = pricePerQuery;
    }

    @Override
    public BigDecimal estimate(SearchRequest request) {
        int pages = Math.max(1, (request.numOrDefault() + RESULTS_PER_PAGE - 1) / RESULTS_PER_PAGE);
        return pricePerQuery.multiply(BigDecimal.valueOf(pages));
    }

    @Override
    public long unitsServed(SearchResponse response) {
        return response.getResults() == null ? 0 : response.getResults().size();
    }

    @Override
    public Class<SearchResponse> responseType() {
        return SearchResponse.class;
    }
}
