package com.sports.sync.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forSynchronization should set correlationId, entityType, and operation in MDC")
    void forSynchronizationSetsMDC() {
        try (LogContext ctx = LogContext.forSynchronization("corr-123", "TEAM")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("TEAM", MDC.get("entityType"));
            assertEquals("synchronize", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPair should set the provider pair and pass in MDC")
    void forPairSetsMDC() {
        try (LogContext ctx = LogContext.forPair("opta", "statsbomb", 2)) {
            assertEquals("opta|statsbomb", MDC.get("pair"));
            assertEquals("2", MDC.get("pass"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSynchronization("corr-123", "TEAM");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("entityType"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested pair context leaves the outer context in place")
    void nestedContexts() {
        try (LogContext outer = LogContext.forSynchronization("corr-1", "PLAYER")) {
            try (LogContext inner = LogContext.forPair("opta", "wyscout", 1)) {
                assertEquals("corr-1", MDC.get("correlationId"));
                assertEquals("opta|wyscout", MDC.get("pair"));
            }
            assertNull(MDC.get("pair"));
            assertEquals("corr-1", MDC.get("correlationId"));
        }
    }

    @Test
    @DisplayName("with() should add extra keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forSynchronization("corr-1", "MATCH").with("group", "epl-2023")) {
            assertEquals("epl-2023", MDC.get("group"));
        }
        assertNull(MDC.get("group"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void correlationIdsUnique() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
