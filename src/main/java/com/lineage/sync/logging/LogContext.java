package com.lineage.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Puts run-scoped keys into the SLF4J MDC and removes them on close.
 *
 * <p>The MDC is thread-local, so worker threads open their own context for
 * each unit they execute:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(runId, batchIndex)) {
 *     log.info("batch.completed processed={}", processed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String BATCH_ID = "batchId";
    public static final String PHASE = "phase";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole synchronization run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(PHASE, "main");
        return ctx;
    }

    /**
     * Context for one batch of work units.
     */
    public static LogContext forBatch(String runId, int batchIndex) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(BATCH_ID, Integer.toString(batchIndex));
        ctx.put(PHASE, "main");
        return ctx;
    }

    /**
     * Context for the recovery pass.
     */
    public static LogContext forRecovery(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(PHASE, "recovery");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
