package com.bastion.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OperationKind.
 */
class OperationKindTest {

    @Test
    void testFromStringIsLenient() {
        assertEquals(OperationKind.CONTENT_GENERATION, OperationKind.fromString("content-generation"));
        assertEquals(OperationKind.SERP_ANALYSIS, OperationKind.fromString("serp_analysis"));
        assertEquals(OperationKind.SCREENSHOT_CAPTURE, OperationKind.fromString(" SCREENSHOT_CAPTURE "));
    }

    @Test
    void testFromStringRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> OperationKind.fromString("summarization"));
        assertThrows(IllegalArgumentException.class, () -> OperationKind.fromString(" "));
        assertThrows(IllegalArgumentException.class, () -> OperationKind.fromString(null));
    }

    @Test
    void testEveryKindBelongsToOneCategory() {
        for (OperationKind kind : OperationKind.values()) {
            assertNotNull(kind.getCategory());
            assertTrue(kind.getDefaultPolicy().getTtl().getSeconds() > 0);
        }
        assertEquals(ProviderCategory.SCRAPE, OperationKind.LINK_ANALYSIS.getCategory());
        assertEquals("keyword_research", OperationKind.KEYWORD_RESEARCH.keyPrefix());
    }
}
