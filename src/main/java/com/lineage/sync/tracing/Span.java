package com.lineage.sync.tracing;

/**
 * A traced unit of work: a synchronization run, one batch, or the recovery pass.
 * Closing the span ends it, so spans are used with try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan("lineage.sync.batch")) {
 *     span.setAttribute("batch.index", index);
 *     // ... write the batch ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Records a point-in-time event, such as the end of the clear phase.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
