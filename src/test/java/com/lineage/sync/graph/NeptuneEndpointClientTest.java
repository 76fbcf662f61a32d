package com.lineage.sync.graph;

import com.lineage.sync.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("NeptuneEndpointClient Tests")
class NeptuneEndpointClientTest {

    private QueryTransport transport;
    private List<Duration> sleeps;
    private SimpleMeterRegistry registry;
    private NeptuneEndpointClient client;

    @BeforeEach
    void setUp() {
        transport = mock(QueryTransport.class);
        sleeps = new ArrayList<>();
        registry = new SimpleMeterRegistry();
        client = NeptuneEndpointClient.builder()
                .transport(transport)
                .sleeper(sleeps::add)
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    // ========== Conflict retries ==========

    @Nested
    @DisplayName("Conflict retries")
    class ConflictRetries {

        @Test
        @DisplayName("Vertex upsert gives up after three attempts")
        void vertexConflictExhausted() {
            when(transport.submit(any())).thenThrow(new ConcurrentModificationConflictException("conflict"));

            QueryOutcome outcome = client.upsertVertex("lineage_node", "orders", Map.of());

            assertEquals(QueryOutcome.Status.CONFLICT_EXHAUSTED, outcome.status());
            assertEquals(2, outcome.conflictRetries());
            verify(transport, times(3)).submit(any());
            assertEquals(2, registry.counter("lineage.sync.conflict.retries").count());
        }

        @Test
        @DisplayName("Edge upsert gives up after five attempts with increasing delays")
        void edgeConflictExhausted() {
            when(transport.submit(any())).thenThrow(new ConcurrentModificationConflictException("conflict"));

            QueryOutcome outcome = client.upsertEdge("orders", "daily_sales", "data_flow", Map.of());

            assertEquals(QueryOutcome.Status.CONFLICT_EXHAUSTED, outcome.status());
            verify(transport, times(5)).submit(any());
            assertEquals(4, sleeps.size());
            for (int i = 1; i < sleeps.size(); i++) {
                assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) > 0);
            }
        }

        @Test
        @DisplayName("Succeeds once the conflict clears")
        void conflictThenSuccess() {
            when(transport.submit(any()))
                    .thenThrow(new ConcurrentModificationConflictException("conflict"))
                    .thenReturn("{}");

            QueryOutcome outcome = client.upsertVertex("lineage_node", "orders", Map.of());

            assertTrue(outcome.isSuccess());
            assertEquals(1, outcome.conflictRetries());
            assertEquals(1, sleeps.size());
        }

        @Test
        @DisplayName("Interrupted backoff ends the call as transient")
        void interruptedBackoff() {
            when(transport.submit(any())).thenThrow(new ConcurrentModificationConflictException("conflict"));
            NeptuneEndpointClient interrupted = NeptuneEndpointClient.builder()
                    .transport(transport)
                    .sleeper(d -> {
                        throw new InterruptedException();
                    })
                    .build();

            QueryOutcome outcome = interrupted.upsertVertex("lineage_node", "orders", Map.of());

            assertEquals(QueryOutcome.Status.TRANSIENT_FAILURE, outcome.status());
            assertTrue(Thread.interrupted());
        }
    }

    // ========== Other failures ==========

    @Nested
    @DisplayName("Other failures")
    class OtherFailures {

        @Test
        @DisplayName("Transient failures are not retried inline")
        void transientNotRetried() {
            when(transport.submit(any())).thenThrow(new TransientQueryException("timeout"));

            QueryOutcome outcome = client.upsertEdge("a", "b", "data_flow", Map.of());

            assertEquals(QueryOutcome.Status.TRANSIENT_FAILURE, outcome.status());
            verify(transport, times(1)).submit(any());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("Rejections are not retried")
        void rejectionNotRetried() {
            when(transport.submit(any())).thenThrow(new QueryRejectedException(400, "bad query"));

            QueryOutcome outcome = client.upsertVertex("lineage_node", "orders", Map.of());

            assertEquals(QueryOutcome.Status.REJECTED, outcome.status());
            verify(transport, times(1)).submit(any());
        }

        @Test
        @DisplayName("Unexpected transport exceptions become transient outcomes")
        void unexpectedException() {
            when(transport.submit(any())).thenThrow(new IllegalStateException("bug"));
            assertEquals(QueryOutcome.Status.TRANSIENT_FAILURE,
                    client.upsertVertex("lineage_node", "orders", Map.of()).status());
        }

        @Test
        @DisplayName("Queries that cannot be built are rejected without a request")
        void invalidQuery() {
            QueryOutcome outcome = client.upsertVertex("lineage_node", " ", Map.of());

            assertEquals(QueryOutcome.Status.REJECTED, outcome.status());
            verifyNoInteractions(transport);
        }
    }

    // ========== Aggregates ==========

    @Test
    @DisplayName("Parses counts and samples")
    void aggregates() {
        when(transport.submit(any())).thenAnswer(invocation -> {
            GraphQuery query = invocation.getArgument(0);
            if (query.getKind() == GraphQuery.Kind.SAMPLE_VERTICES) {
                return "{\"result\":{\"data\":[{\"name\":\"orders\",\"source\":\"athena\"}]}}";
            }
            return "{\"result\":{\"data\":[3]}}";
        });

        assertEquals(OptionalLong.of(3), client.count(GremlinQueries.countVertices()));
        assertEquals(List.of(new VertexSample("orders", "athena")), client.sample(5));
    }

    @Test
    @DisplayName("Failed or unparseable counts are empty")
    void failedCount() {
        when(transport.submit(any())).thenReturn("not json");
        assertTrue(client.count(GremlinQueries.countEdges()).isEmpty());

        when(transport.submit(any())).thenThrow(new TransientQueryException("down"));
        assertTrue(client.count(GremlinQueries.countEdges()).isEmpty());
        assertTrue(client.sample(5).isEmpty());
    }

    @Test
    @DisplayName("Records query durations by kind and outcome")
    void recordsDurations() {
        when(transport.submit(any())).thenReturn("{}");
        client.upsertVertex("lineage_node", "orders", Map.of());

        assertEquals(1, registry.get("lineage.sync.query.duration")
                .tag("kind", "upsert_vertex").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("Repeated upserts store one vertex and one edge")
    void upsertsIdempotent() {
        InMemoryGremlinTransport store = new InMemoryGremlinTransport();
        NeptuneEndpointClient inMemory = NeptuneEndpointClient.builder().transport(store).build();

        for (int i = 0; i < 2; i++) {
            assertTrue(inMemory.upsertVertex("lineage_node", "orders", Map.of("source_type", "athena")).isSuccess());
            assertTrue(inMemory.upsertVertex("lineage_node", "returns", Map.of("source_type", "athena")).isSuccess());
            assertTrue(inMemory.upsertEdge("orders", "returns", "data_flow", Map.of()).isSuccess());
        }

        assertEquals(2, store.vertexCount());
        assertEquals(1, store.edgeCount());
    }

    @Test
    @DisplayName("Closes its transport")
    void closesTransport() throws Exception {
        client.close();
        verify(transport).close();
    }
}
