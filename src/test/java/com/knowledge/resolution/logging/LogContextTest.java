package com.knowledge.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forBuild should set runId and operation in MDC")
    void forBuild() {
        try (LogContext ctx = LogContext.forBuild("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("build", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forLinking should set runId and operation in MDC")
    void forLinking() {
        try (LogContext ctx = LogContext.forLinking("run-2")) {
            assertEquals("run-2", MDC.get("runId"));
            assertEquals("link", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Closing removes every key the context added")
    void closeRemovesKeys() {
        try (LogContext ctx = LogContext.forBuild("run-3").with("provider", "zero")) {
            assertEquals("zero", MDC.get("provider"));
        }

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("provider"));
    }

    @Test
    @DisplayName("Keys set outside the context survive it")
    void foreignKeysSurvive() {
        MDC.put("tenant", "acme");
        try (LogContext ctx = LogContext.forLinking("run-4")) {
            assertEquals("acme", MDC.get("tenant"));
        }

        assertEquals("acme", MDC.get("tenant"));
    }

    @Test
    @DisplayName("generateRunId should produce unique ids")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
