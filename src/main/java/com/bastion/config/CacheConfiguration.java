package com.bastion.config;

import com.bastion.repository.CacheStore;
import com.bastion.repository.CaffeineCacheStore;
import com.bastion.service.CachePolicies;
import com.bastion.service.CacheStatisticsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Cache policies, statistics and the in-memory Caffeine store.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final BastionProperties properties;

    public CacheConfiguration(BastionProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "bastion.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public CacheStore caffeineCacheStore() {
        log.info("Using in-memory cache store (max {} entries)", properties.getCache().getMaxEntries());
        return new CaffeineCacheStore(properties.getCache().getMaxEntries());
    }

    @Bean
    public CachePolicies cachePolicies() {
        return CachePolicies.from(properties.getCache());
    }

    @Bean
    public CacheStatisticsRecorder cacheStatisticsRecorder(Clock clock) {
        return new CacheStatisticsRecorder(clock);
    }
}
