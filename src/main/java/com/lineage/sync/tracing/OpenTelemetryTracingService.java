package com.lineage.sync.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 *
 * <p>Spans are started without being made current; the batch scheduler hands
 * work to pool threads, so context propagation would not follow anyway.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return new OTelSpanAdapter(tracer.spanBuilder(operationName).startSpan());
    }

    @Override
    public Span startSpan(String operationName, Map<String, ?> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (value instanceof Long || value instanceof Integer) {
                    builder.setAttribute(key, ((Number) value).longValue());
                } else if (value != null) {
                    builder.setAttribute(key, value.toString());
                }
            });
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            otelSpan.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
