package com.lineage.sync.sync;

import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.LineageColumn;
import com.lineage.sync.core.model.LineageEdge;
import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.graph.LineageSchema;
import com.lineage.sync.graph.NeptuneEndpointClient;
import com.lineage.sync.graph.QueryOutcome;
import com.lineage.sync.graph.QuerySanitizer;
import com.lineage.sync.graph.VertexRef;
import com.lineage.sync.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Writes vertices and edges of a merged graph through the endpoint client,
 * consulting the session ledger so that each entity is sent at most once per
 * phase.
 *
 * <p>Besides lineage nodes and their data flow edges, the writer handles the
 * column layer: column vertices keyed by column id, {@code has_column} edges
 * from a dataset to its columns and {@code column_lineage} edges between
 * columns.</p>
 *
 * <p>Methods report success as a boolean and never throw for store failures;
 * deciding what to record for recovery is left to the caller. A rejected
 * query is final: the entity is marked {@link EntityState#STILL_FAILED} and
 * is not sent again, not even by the recovery pass. Attribute values that
 * cannot be written as literals are dropped with a warning.</p>
 */
public class LineageGraphWriter {
    private static final Logger log = LoggerFactory.getLogger(LineageGraphWriter.class);

    private final NeptuneEndpointClient client;
    private final MergedGraph graph;
    private final SyncSession session;
    private final MetricsService metricsService;
    private final String createdTimestamp;

    public LineageGraphWriter(NeptuneEndpointClient client, MergedGraph graph, SyncSession session,
                              MetricsService metricsService) {
        this.client = client;
        this.graph = graph;
        this.session = session;
        this.metricsService = metricsService;
        this.createdTimestamp = graph.getCreatedAt().toString();
    }

    /**
     * Upserts the vertex of a node.
     *
     * @return true if the vertex is known to exist in the store
     */
    public boolean writeVertex(String nodeId) {
        SyncSession.Admission admission = session.admitVertex(nodeId);
        if (admission != SyncSession.Admission.SEND) {
            return admission == SyncSession.Admission.ALREADY_SUCCEEDED;
        }

        QueryOutcome outcome = client.upsertVertex(LineageSchema.VERTEX_LABEL, nodeId, vertexProperties(nodeId));
        session.addConflictRetries(outcome.conflictRetries());
        if (outcome.isSuccess()) {
            session.vertexSucceeded(nodeId);
            metricsService.incrementVertexUpserted();
            return true;
        }
        if (outcome.status() == QueryOutcome.Status.REJECTED) {
            session.vertexRejected(nodeId);
        } else {
            session.vertexFailed(nodeId);
        }
        metricsService.incrementFailure("vertex");
        log.warn("vertex.failed node={} phase={} reason={}", nodeId, session.getPhase(), outcome.describe());
        return false;
    }

    /**
     * Upserts the edge from {@code parent} to {@code child}, first making sure
     * both endpoint vertices exist.
     *
     * @return true if the edge is known to exist in the store
     */
    public boolean writeEdge(String parent, String child) {
        SyncSession.Admission admission = session.admitEdge(parent, child);
        if (admission != SyncSession.Admission.SEND) {
            return admission == SyncSession.Admission.ALREADY_SUCCEEDED;
        }

        if (!writeVertex(parent) || !writeVertex(child)) {
            session.edgeFailed(parent, child);
            metricsService.incrementFailure("edge");
            log.warn("edge.failed parent={} child={} phase={} reason=endpoint_missing",
                    parent, child, session.getPhase());
            return false;
        }

        LineageEdge edge = graph.edge(parent, child);
        QueryOutcome outcome = client.upsertEdge(parent, child, LineageSchema.EDGE_LABEL, edgeProperties(edge));
        session.addConflictRetries(outcome.conflictRetries());
        if (outcome.isSuccess()) {
            session.edgeSucceeded(parent, child);
            metricsService.incrementEdgeUpserted();
            return true;
        }
        if (outcome.status() == QueryOutcome.Status.REJECTED) {
            session.edgeRejected(parent, child);
        } else {
            session.edgeFailed(parent, child);
        }
        metricsService.incrementFailure("edge");
        log.warn("edge.failed parent={} child={} phase={} reason={}",
                parent, child, session.getPhase(), outcome.describe());
        return false;
    }

    // ========== Columns ==========

    /**
     * Upserts the vertex of a column.
     *
     * @return true if the column vertex is known to exist in the store
     */
    public boolean writeColumn(ColumnKey key) {
        String columnId = key.columnId();
        SyncSession.Admission admission = session.admitColumn(columnId);
        if (admission != SyncSession.Admission.SEND) {
            return admission == SyncSession.Admission.ALREADY_SUCCEEDED;
        }

        QueryOutcome outcome = client.upsertVertex(VertexRef.column(columnId), columnProperties(graph.column(key)));
        session.addConflictRetries(outcome.conflictRetries());
        if (outcome.isSuccess()) {
            session.columnSucceeded(columnId);
            return true;
        }
        if (outcome.status() == QueryOutcome.Status.REJECTED) {
            session.columnRejected(columnId);
        } else {
            session.columnFailed(columnId);
        }
        metricsService.incrementFailure("column");
        log.warn("column.failed column={} phase={} reason={}", key, session.getPhase(), outcome.describe());
        return false;
    }

    /**
     * Upserts the {@code has_column} edge from the column's dataset to the
     * column. Columns whose dataset is not a node of the graph have no such
     * edge and count as written.
     *
     * @return true if the edge is known to exist in the store or is not needed
     */
    public boolean writeColumnMembership(ColumnKey key) {
        if (!graph.isAttached(key)) {
            return true;
        }
        String columnId = key.columnId();
        String ledgerKey = LineageSchema.HAS_COLUMN_LABEL + ":" + key.dataset() + "->" + columnId;
        SyncSession.Admission admission = session.admitColumnEdge(ledgerKey);
        if (admission != SyncSession.Admission.SEND) {
            return admission == SyncSession.Admission.ALREADY_SUCCEEDED;
        }

        if (!writeVertex(key.dataset()) || !writeColumn(key)) {
            return columnEdgeFailed(ledgerKey, null, "endpoint_missing");
        }
        QueryOutcome outcome = client.upsertEdge(VertexRef.node(key.dataset()), VertexRef.column(columnId),
                LineageSchema.HAS_COLUMN_LABEL,
                Map.of(LineageSchema.CREATED_TIMESTAMP_PROPERTY, createdTimestamp));
        return columnEdgeOutcome(ledgerKey, outcome);
    }

    /**
     * Upserts the {@code column_lineage} edge of a mapping, first making sure
     * both column vertices exist.
     *
     * @return true if the edge is known to exist in the store
     */
    public boolean writeColumnEdge(ColumnMapping mapping) {
        String ledgerKey = LineageSchema.COLUMN_LINEAGE_LABEL + ":" + mapping.key();
        SyncSession.Admission admission = session.admitColumnEdge(ledgerKey);
        if (admission != SyncSession.Admission.SEND) {
            return admission == SyncSession.Admission.ALREADY_SUCCEEDED;
        }

        if (!writeColumn(mapping.source()) || !writeColumn(mapping.target())) {
            return columnEdgeFailed(ledgerKey, null, "endpoint_missing");
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(LineageSchema.TRANSFORMATION_PROPERTY, mapping.transformation());
        properties.put(LineageSchema.CREATED_TIMESTAMP_PROPERTY, createdTimestamp);
        dropUnrenderable(mapping.key(), properties);
        QueryOutcome outcome = client.upsertEdge(VertexRef.column(mapping.source().columnId()),
                VertexRef.column(mapping.target().columnId()), LineageSchema.COLUMN_LINEAGE_LABEL, properties);
        return columnEdgeOutcome(ledgerKey, outcome);
    }

    private boolean columnEdgeOutcome(String ledgerKey, QueryOutcome outcome) {
        session.addConflictRetries(outcome.conflictRetries());
        if (outcome.isSuccess()) {
            session.columnEdgeSucceeded(ledgerKey);
            return true;
        }
        return columnEdgeFailed(ledgerKey, outcome.status(), outcome.describe());
    }

    private boolean columnEdgeFailed(String ledgerKey, QueryOutcome.Status status, String reason) {
        if (status == QueryOutcome.Status.REJECTED) {
            session.columnEdgeRejected(ledgerKey);
        } else {
            session.columnEdgeFailed(ledgerKey);
        }
        metricsService.incrementFailure("column_edge");
        log.warn("columnEdge.failed edge={} phase={} reason={}", ledgerKey, session.getPhase(), reason);
        return false;
    }

    // ========== Recovery ==========

    /**
     * Replays a recorded failure: the node's vertex and all its edges, a
     * single edge, a column with its membership and lineage edges, or a single
     * column lineage edge.
     *
     * @return true if everything the operation covers is now written
     */
    public boolean replay(PendingOperation operation) {
        if (operation instanceof PendingOperation.NodeRetry node) {
            if (!writeVertex(node.id())) {
                return false;
            }
            boolean allEdges = true;
            for (String child : node.children()) {
                allEdges &= writeEdge(node.id(), child);
            }
            return allEdges;
        }
        if (operation instanceof PendingOperation.EdgeRetry edge) {
            return writeEdge(edge.parent(), edge.child());
        }
        if (operation instanceof PendingOperation.ColumnRetry column) {
            if (!writeColumn(column.column()) || !writeColumnMembership(column.column())) {
                return false;
            }
            boolean allEdges = true;
            for (ColumnMapping mapping : graph.mappingsFrom(column.column())) {
                allEdges &= writeColumnEdge(mapping);
            }
            return allEdges;
        }
        if (operation instanceof PendingOperation.ColumnEdgeRetry edge) {
            return writeColumnEdge(edge.mapping());
        }
        throw new IllegalArgumentException("Unknown pending operation: " + operation);
    }

    Map<String, Object> vertexProperties(String nodeId) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(LineageSchema.SOURCE_TYPE_PROPERTY, graph.provenanceOf(nodeId).label());
        properties.put(LineageSchema.CREATED_TIMESTAMP_PROPERTY, createdTimestamp);
        putAttributes(properties, graph.attributesOf(nodeId), LineageSchema.RESERVED_VERTEX_PROPERTIES);
        dropUnrenderable(nodeId, properties);
        return properties;
    }

    Map<String, Object> columnProperties(LineageColumn column) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(LineageSchema.COLUMN_NAME_PROPERTY, column.key().column());
        properties.put(LineageSchema.DATASET_PROPERTY, column.key().dataset());
        properties.put(LineageSchema.SOURCE_TYPE_PROPERTY, column.provenance().label());
        properties.put(LineageSchema.CREATED_TIMESTAMP_PROPERTY, createdTimestamp);
        putAttributes(properties, column.attributes(), LineageSchema.RESERVED_COLUMN_PROPERTIES);
        dropUnrenderable(column.key().qualifiedName(), properties);
        return properties;
    }

    private static void putAttributes(Map<String, Object> properties, Map<String, Object> attributes,
                                      Set<String> reserved) {
        attributes.forEach((key, value) -> {
            if (!reserved.contains(key)) {
                properties.put(key, value);
            }
        });
    }

    /**
     * Removes values that cannot become query literals, so that one bad
     * attribute does not cost the whole vertex.
     */
    private static void dropUnrenderable(String owner, Map<String, Object> properties) {
        properties.entrySet().removeIf(entry -> {
            // null values are skipped by the query builder
            if (entry.getValue() == null || QuerySanitizer.isRenderable(entry.getValue())) {
                return false;
            }
            log.warn("attribute.dropped owner={} attribute={} type={}", owner, entry.getKey(),
                    entry.getValue().getClass().getSimpleName());
            return true;
        });
    }

    private Map<String, Object> edgeProperties(LineageEdge edge) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(LineageSchema.EDGE_TYPE_PROPERTY, edge.edgeType().wireValue());
        properties.put(LineageSchema.PARENT_SOURCE_PROPERTY, edge.parentProvenance().label());
        properties.put(LineageSchema.CHILD_SOURCE_PROPERTY, edge.childProvenance().label());
        properties.put(LineageSchema.CREATED_TIMESTAMP_PROPERTY, createdTimestamp);
        return properties;
    }
}
