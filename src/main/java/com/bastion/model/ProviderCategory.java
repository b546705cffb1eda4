package com.bastion.model;

/**
 * Kind of external dependency a route talks to. Each category has one provider route.
 */
public enum ProviderCategory {
    LLM,
    SEARCH,
    SCRAPE
}
