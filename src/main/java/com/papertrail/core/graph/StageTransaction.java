package com.papertrail.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for the graph writes of one pipeline stage.
 * Compensations run in reverse order if a step fails or the transaction is
 * closed without {@link #markSuccess()}.
 *
 * <pre>
 * try (StageTransaction tx = new StageTransaction("derive")) {
 *     tx.execute("edges CO_BID_WITH", () -> writeEdges(...), () -> deleteEdges(...));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class StageTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageTransaction.class);

    private final String stage;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public StageTransaction(String stage) {
        this.stage = stage;
    }

    /**
     * Runs {@code operation} and registers {@code compensation}. The
     * compensation is registered before the operation runs, since a failed
     * batch may have written part of its rows.
     *
     * @throws RuntimeException the operation's failure, after all compensations ran
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        compensationStack.push(new CompensatingAction(description, compensation));
        try {
            log.debug("stage.step stage={} step={}", stage, description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("stage.step_failed stage={} step={} error={}", stage, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("stage.rollback stage={} steps={}", stage, compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("stage.compensate stage={} step={}", stage, action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("stage.compensation_failed stage={} step={} error={}",
                        stage, action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
