package com.bastion.resilience;

import com.bastion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProviderHealthRegistry.
 */
class ProviderHealthRegistryTest {

    private MutableClock clock;
    private ProviderHealthRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        registry = new ProviderHealthRegistry(5, Duration.ofMinutes(5), clock);
    }

    @Test
    void testMarkedUnavailableAtThreshold() {
        registry.register("openai");
        for (int i = 0; i < 4; i++) {
            registry.recordFailure("openai");
        }
        assertTrue(registry.isAvailable("openai"));

        registry.recordFailure("openai");
        assertFalse(registry.isAvailable("openai"));

        ProviderHealthRecord record = registry.getRecord("openai");
        assertFalse(record.isAvailable());
        assertEquals(5, record.getFailureCount());
    }

    @Test
    void testOptimisticRecoveryAfterCooldown() {
        for (int i = 0; i < 5; i++) {
            registry.recordFailure("serper");
        }
        clock.advance(Duration.ofMinutes(4));
        assertFalse(registry.isAvailable("serper"));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(registry.isAvailable("serper"));

        ProviderHealthRecord record = registry.getRecord("serper");
        assertTrue(record.isAvailable());
        assertEquals(0, record.getFailureCount());
    }

    @Test
    void testSuccessResetsFailures() {
        for (int i = 0; i < 5; i++) {
            registry.recordFailure("firecrawl");
        }
        clock.advance(Duration.ofSeconds(30));
        registry.recordSuccess("firecrawl");

        ProviderHealthRecord record = registry.getRecord("firecrawl");
        assertTrue(record.isAvailable());
        assertEquals(0, record.getFailureCount());
        assertEquals(clock.instant(), record.getLastCheck());
    }

    @Test
    void testUnknownProviderIsRegisteredLazily() {
        assertTrue(registry.isAvailable("never-registered"));
        assertEquals(1, registry.getRecords().size());
    }

    @Test
    void testRecordsKeepRegistrationOrder() {
        registry.register("serper");
        registry.register("serpapi");
        registry.register("openai");

        List<String> ids = registry.getRecords().stream()
                .map(ProviderHealthRecord::getProviderId)
                .collect(Collectors.toList());
        assertEquals(List.of("serper", "serpapi", "openai"), ids);
    }

    @Test
    void testCheckHealthAttachesQuota() {
        registry.register("serpapi", () -> Mono.just(QuotaStatus.builder().used(40).limit(100).build()));
        registry.register("openai");
        registry.register("firecrawl", () -> Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(registry.checkHealth())
                .assertNext(records -> {
                    assertEquals(3, records.size());
                    assertEquals(60, records.get(0).getQuota().remaining());
                    assertNull(records.get(1).getQuota());
                    assertNull(records.get(2).getQuota());
                    assertTrue(records.get(2).isAvailable());
                })
                .verifyComplete();
    }

    @Test
    void testRejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProviderHealthRegistry(0, Duration.ofMinutes(1), clock));
    }
}
