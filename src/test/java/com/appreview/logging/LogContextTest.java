package com.appreview.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should populate the MDC for a review operation and clear it on close")
    void forReview() {
        try (LogContext ctx = LogContext.forReview("castVote", "r-1", "sup-1")) {
            assertEquals("castVote", MDC.get("operation"));
            assertEquals("r-1", MDC.get("reviewId"));
            assertEquals("sup-1", MDC.get("actorId"));
            assertNotNull(MDC.get("correlationId"));
        }
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("reviewId"));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("Should skip absent ids and accept extra keys")
    void optionalKeys() {
        try (LogContext ctx = LogContext.forReview("submit", null, "alice").with("appId", "app-1")) {
            assertNull(MDC.get("reviewId"));
            assertEquals("app-1", MDC.get("appId"));
        }
        assertNull(MDC.get("appId"));
    }

    @Test
    @DisplayName("Correlation ids are unique")
    void uniqueCorrelationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
