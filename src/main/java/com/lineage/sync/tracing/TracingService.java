package com.lineage.sync.tracing;

import java.util.Map;

/**
 * Creates spans for the phases of a synchronization run.
 * {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    String RUN_SPAN = "lineage.sync.run";
    String BATCH_SPAN = "lineage.sync.batch";
    String RECOVERY_SPAN = "lineage.sync.recovery";

    Span startSpan(String operationName);

    /**
     * Starts a span with initial attributes. String values are recorded as
     * strings, integral numbers as longs, anything else through {@code toString()}.
     */
    Span startSpan(String operationName, Map<String, ?> attributes);
}
