package com.papertrail.core.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. On close every key is restored to the value it
 * had before this context set it, so contexts nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStage(runId, "DERIVE")) {
 *     log.info("derive.completed edges={}", edges.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";
    public static final String DETECTOR = "detector";

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = forRun(runId);
        ctx.put(STAGE, stage);
        return ctx;
    }

    /**
     * Detectors run on pool threads, so the run id is set again there.
     */
    public static LogContext forDetector(String runId, String detector) {
        LogContext ctx = forRun(runId);
        ctx.put(DETECTOR, detector);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
