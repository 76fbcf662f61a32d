package com.lineage.sync.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GremlinQueries Tests")
class GremlinQueriesTest {

    // ========== Upserts ==========

    @Test
    @DisplayName("Vertex upsert checks existence before creating")
    void vertexUpsert() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("source_type", "athena");
        props.put("row_count", 12L);

        GraphQuery query = GremlinQueries.upsertVertex("lineage_node", "orders", props);

        assertEquals(GraphQuery.Kind.UPSERT_VERTEX, query.getKind());
        assertEquals("g.V().has('lineage_node','node_name','orders').fold()" +
                ".coalesce(unfold(),addV('lineage_node').property('node_name','orders')" +
                ".property('source_type','athena').property('row_count',12))", query.render());
        assertEquals("athena", query.binding("p_source_type"));
    }

    @Test
    @DisplayName("Quotes in node ids cannot break out of the literal")
    void vertexUpsertEscapesKey() {
        GraphQuery query = GremlinQueries.upsertVertex("lineage_node", "o'); g.V().drop(); ('", Map.of());

        String rendered = query.render();
        assertTrue(rendered.contains("'o\\'); g.V().drop(); (\\''"), rendered);
    }

    @Test
    @DisplayName("Null property values are skipped")
    void nullPropertiesSkipped() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("owner", null);
        GraphQuery query = GremlinQueries.upsertVertex("lineage_node", "orders", props);
        assertFalse(query.render().contains("owner"));
    }

    @Test
    @DisplayName("Edge upsert only adds a missing edge between existing vertices")
    void edgeUpsert() {
        GraphQuery query = GremlinQueries.upsertEdge("orders", "daily_sales", "data_flow",
                Map.of("edge_type", "cross_system"));

        assertEquals("g.V().has('lineage_node','node_name','orders').as('p')" +
                ".V().has('lineage_node','node_name','daily_sales')" +
                ".coalesce(inE('data_flow').where(outV().as('p')),addE('data_flow').from('p')" +
                ".property('edge_type','cross_system'))", query.render());
        assertEquals("orders", query.binding("from"));
        assertEquals("daily_sales", query.binding("to"));
    }

    @Test
    @DisplayName("Column vertices are keyed by column_id")
    void columnVertexUpsert() {
        GraphQuery query = GremlinQueries.upsertVertex(VertexRef.column("abc123"), Map.of("column_name", "id"));

        assertEquals("column", query.getLabel());
        assertEquals("g.V().has('column','column_id','abc123').fold()" +
                ".coalesce(unfold(),addV('column').property('column_id','abc123')" +
                ".property('column_name','id'))", query.render());
    }

    @Test
    @DisplayName("Membership edge joins a lineage node to a column")
    void mixedEndpointEdge() {
        GraphQuery query = GremlinQueries.upsertEdge(VertexRef.node("orders"), VertexRef.column("abc123"),
                "has_column", Map.of());

        assertEquals("g.V().has('lineage_node','node_name','orders').as('p')" +
                ".V().has('column','column_id','abc123')" +
                ".coalesce(inE('has_column').where(outV().as('p')),addE('has_column').from('p'))", query.render());
        assertEquals("has_column", query.getLabel());
    }

    @Test
    @DisplayName("Invalid labels and property keys are rejected at build time")
    void invalidNamesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GremlinQueries.upsertVertex("bad label", "orders", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> GremlinQueries.upsertEdge("a", "b", "data_flow", Map.of("bad-key", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> GremlinQueries.upsertVertex("lineage_node", "orders", Map.of("when", new Object())));
    }

    // ========== Aggregates ==========

    @Test
    @DisplayName("Counts with and without a filter")
    void counts() {
        assertEquals("g.V().count()", GremlinQueries.countVertices().render());
        assertEquals("g.E().count()", GremlinQueries.countEdges().render());
        assertEquals("g.V().has('source_type','athena,redshift').count()",
                GremlinQueries.countVertices("source_type", "athena,redshift").render());
        assertEquals("g.E().has('edge_type','cross_system').count()",
                GremlinQueries.countEdges("edge_type", "cross_system").render());
    }

    @Test
    @DisplayName("Counts scoped to a label")
    void labelledCounts() {
        assertEquals("g.V().hasLabel('column').count()",
                GremlinQueries.countVerticesWithLabel("column").render());
        assertEquals("g.V().hasLabel('lineage_node').has('source_type','athena').count()",
                GremlinQueries.countVerticesWithLabel("lineage_node", "source_type", "athena").render());
        assertEquals("g.E().hasLabel('data_flow').count()",
                GremlinQueries.countEdgesWithLabel("data_flow").render());
        GraphQuery crossSystem = GremlinQueries.countEdgesWithLabel("data_flow", "edge_type", "cross_system");
        assertEquals("g.E().hasLabel('data_flow').has('edge_type','cross_system').count()", crossSystem.render());
        assertEquals("data_flow", crossSystem.getLabel());
        assertThrows(IllegalArgumentException.class, () -> GremlinQueries.countEdgesWithLabel("bad label"));
    }

    @Test
    @DisplayName("Drop and sample")
    void dropAndSample() {
        assertEquals("g.V().drop()", GremlinQueries.dropAll().render());
        assertEquals("g.V().hasLabel('lineage_node').limit(5).project('name','source')" +
                        ".by('node_name').by('source_type')",
                GremlinQueries.sampleVertices(5).render());
        assertThrows(IllegalArgumentException.class, () -> GremlinQueries.sampleVertices(0));
    }
}
