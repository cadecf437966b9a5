package com.papertrail.core.logging;

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
    @DisplayName("forStage should set runId and stage in MDC")
    void forStageSetsMDC() {
        try (LogContext ctx = LogContext.forStage("run-1", "DERIVE")) {
            assertEquals("run-1", MDC.get(LogContext.RUN_ID));
            assertEquals("DERIVE", MDC.get(LogContext.STAGE));
        }
        assertNull(MDC.get(LogContext.RUN_ID));
        assertNull(MDC.get(LogContext.STAGE));
    }

    @Test
    @DisplayName("Nested contexts should restore the outer values on close")
    void nestedContextsRestore() {
        try (LogContext outer = LogContext.forStage("run-1", "DETECT")) {
            try (LogContext inner = LogContext.forDetector("run-1", "single_bidder").with(LogContext.STAGE, "inner")) {
                assertEquals("single_bidder", MDC.get(LogContext.DETECTOR));
                assertEquals("inner", MDC.get(LogContext.STAGE));
            }
            assertEquals("DETECT", MDC.get(LogContext.STAGE));
            assertEquals("run-1", MDC.get(LogContext.RUN_ID));
            assertNull(MDC.get(LogContext.DETECTOR));
        }
    }

    @Test
    @DisplayName("generateRunId should produce distinct ids")
    void generateRunId() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
