package com.lineage.sync.verify;

import com.lineage.sync.chaos.ChaosQueryTransport;
import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.core.model.SourceLineage;
import com.lineage.sync.graph.GraphQuery;
import com.lineage.sync.graph.InMemoryGremlinTransport;
import com.lineage.sync.graph.NeptuneEndpointClient;
import com.lineage.sync.merge.LineageMerger;
import com.lineage.sync.sync.BatchScheduler;
import com.lineage.sync.sync.SyncOptions;
import com.lineage.sync.sync.SyncSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphVerifier Tests")
class GraphVerifierTest {

    private InMemoryGremlinTransport store;
    private ChaosQueryTransport chaos;
    private NeptuneEndpointClient client;
    private MergedGraph graph;

    @BeforeEach
    void setUp() {
        store = new InMemoryGremlinTransport();
        chaos = new ChaosQueryTransport(store);
        client = NeptuneEndpointClient.builder().transport(chaos).sleeper(d -> { }).build();
        graph = new LineageMerger().merge(List.of(
                SourceLineage.of("athena", Map.of("orders", List.of("daily_sales", "returns"))),
                SourceLineage.of("redshift", Map.of("refunds", List.of("daily_sales")))));
    }

    private void synchronize() {
        BatchScheduler.builder()
                .client(client)
                .options(SyncOptions.defaults())
                .sleeper(d -> { })
                .build()
                .synchronize(graph, new SyncSession("run-1"));
    }

    @Test
    @DisplayName("Counts match the merged graph after a full run")
    void countsMatch() {
        synchronize();

        VerificationReport report = new GraphVerifier(client).verify(graph);

        assertTrue(report.isComplete());
        assertTrue(report.matches(graph.nodeCount(), graph.edgeCount()));
        assertEquals(OptionalLong.of(4), report.vertexCount());
        assertEquals(OptionalLong.of(3), report.edgeCount());
        assertEquals(OptionalLong.of(2), report.crossSystemEdgeCount());
        assertEquals(OptionalLong.of(2), report.verticesBySourceType().get("athena"));
        assertEquals(OptionalLong.of(1), report.verticesBySourceType().get("athena,redshift"));
        assertEquals(OptionalLong.of(1), report.verticesBySourceType().get("redshift"));
    }

    @Test
    @DisplayName("A three node, two edge graph verifies as three and two")
    void threeNodeGraph() {
        graph = new LineageMerger().merge(List.of(
                SourceLineage.of("a", Map.of("x", List.of("y"))),
                SourceLineage.of("b", Map.of("y", List.of("z")))));
        synchronize();

        VerificationReport report = new GraphVerifier(client).verify(graph);

        assertEquals(OptionalLong.of(3), report.vertexCount());
        assertEquals(OptionalLong.of(2), report.edgeCount());
        assertEquals(OptionalLong.of(2), report.crossSystemEdgeCount());
        assertEquals(3, report.sample().size());
    }

    @Test
    @DisplayName("Column vertices and edges are counted apart from lineage nodes")
    void columnsCountedSeparately() {
        ColumnKey orderId = new ColumnKey("orders", "order_id");
        ColumnKey salesOrderId = new ColumnKey("daily_sales", "order_id");
        graph = new LineageMerger().merge(List.of(
                SourceLineage.of("athena", Map.of("orders", List.of("daily_sales")), Map.of(),
                        Map.of(orderId, Map.of("data_type", "bigint")),
                        List.of(new ColumnMapping(orderId, salesOrderId, "cast"))),
                SourceLineage.of("redshift", Map.of("daily_sales", List.of()))));
        synchronize();

        VerificationReport report = new GraphVerifier(client).verify(graph);

        assertTrue(report.isComplete());
        assertTrue(report.matches(graph.nodeCount(), graph.edgeCount()));
        assertEquals(OptionalLong.of(2), report.vertexCount());
        assertEquals(OptionalLong.of(1), report.edgeCount());
        assertEquals(OptionalLong.of(2), report.columnCount());
        assertEquals(OptionalLong.of(1), report.columnLineageEdgeCount());
        assertEquals(4, store.vertexCount());
        assertTrue(report.sample().stream().allMatch(s -> graph.contains(s.name())));
    }

    @Test
    @DisplayName("Sample is limited to the requested size")
    void sampleLimited() {
        synchronize();

        VerificationReport report = new GraphVerifier(client, 2).verify(graph);

        assertEquals(2, report.sample().size());
        assertTrue(graph.contains(report.sample().get(0).name()));
    }

    @Test
    @DisplayName("Failed counts are reported as missing")
    void failedCounts() {
        synchronize();
        chaos.reject(GraphQuery.Kind.COUNT_EDGES);

        VerificationReport report = new GraphVerifier(client).verify(graph);

        assertFalse(report.isComplete());
        assertTrue(report.edgeCount().isEmpty());
        assertFalse(report.matches(graph.nodeCount(), graph.edgeCount()));
        assertEquals(OptionalLong.of(4), report.vertexCount());
    }

    @Test
    @DisplayName("An incomplete store does not match")
    void incompleteStore() {
        VerificationReport report = new GraphVerifier(client).verify(graph);

        assertEquals(OptionalLong.of(0), report.vertexCount());
        assertFalse(report.matches(graph.nodeCount(), graph.edgeCount()));
        assertTrue(report.sample().isEmpty());
    }
}
