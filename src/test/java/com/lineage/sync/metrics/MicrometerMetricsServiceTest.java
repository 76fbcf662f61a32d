package com.lineage.sync.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MicrometerMetricsService Tests")
class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("Counters")
    void counters() {
        metrics.incrementVertexUpserted();
        metrics.incrementVertexUpserted();
        metrics.incrementEdgeUpserted();
        metrics.incrementConflictRetry();
        metrics.incrementRecovered();

        assertEquals(2, registry.counter("lineage.sync.vertex.upserted").count());
        assertEquals(1, registry.counter("lineage.sync.edge.upserted").count());
        assertEquals(1, registry.counter("lineage.sync.conflict.retries").count());
        assertEquals(1, registry.counter("lineage.sync.recovered").count());
    }

    @Test
    @DisplayName("Failures are tagged by entity kind")
    void failuresTagged() {
        metrics.incrementFailure("vertex");
        metrics.incrementFailure("edge");
        metrics.incrementFailure("edge");

        assertEquals(1, registry.get("lineage.sync.failures").tag("entity", "vertex").counter().count());
        assertEquals(2, registry.get("lineage.sync.failures").tag("entity", "edge").counter().count());
    }

    @Test
    @DisplayName("Query timers are tagged by kind and outcome")
    void queryTimers() {
        metrics.recordQueryDuration("upsert_edge", "success", Duration.ofMillis(20));
        metrics.recordQueryDuration("upsert_edge", "success", Duration.ofMillis(40));
        metrics.recordQueryDuration("upsert_edge", "conflict_exhausted", Duration.ofMillis(900));

        var success = registry.get("lineage.sync.query.duration")
                .tag("kind", "upsert_edge").tag("outcome", "success").timer();
        assertEquals(2, success.count());
        assertEquals(60, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get("lineage.sync.query.duration")
                .tag("outcome", "conflict_exhausted").timer().count());
    }

    @Test
    @DisplayName("Run duration and batch size")
    void runAndBatch() {
        metrics.recordRunDuration(Duration.ofSeconds(3));
        metrics.recordBatchSize(5);
        metrics.recordBatchSize(2);

        assertEquals(1, registry.get("lineage.sync.run.duration").timer().count());
        assertEquals(7, registry.get("lineage.sync.batch.size").summary().totalAmount(), 0.001);
    }

    @Test
    @DisplayName("No-op service accepts every call")
    void noOp() {
        MetricsService noOp = new NoOpMetricsService();
        assertDoesNotThrow(() -> {
            noOp.incrementVertexUpserted();
            noOp.incrementFailure("edge");
            noOp.recordQueryDuration("count_vertices", "success", Duration.ZERO);
            noOp.recordBatchSize(1);
        });
    }
}
