package com.lineage.sync.verify;

import com.lineage.sync.core.model.EdgeType;
import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.graph.GremlinQueries;
import com.lineage.sync.graph.LineageSchema;
import com.lineage.sync.graph.NeptuneEndpointClient;
import com.lineage.sync.graph.VertexSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Reads aggregate counts back from the store and compares them with the
 * merged graph. Counts are scoped by label, so the column layer does not
 * inflate the node and data flow figures. Never throws for store failures;
 * missing counts are reported as empty.
 */
public class GraphVerifier {
    private static final Logger log = LoggerFactory.getLogger(GraphVerifier.class);

    private final NeptuneEndpointClient client;
    private final int sampleSize;

    public GraphVerifier(NeptuneEndpointClient client) {
        this(client, 5);
    }

    public GraphVerifier(NeptuneEndpointClient client, int sampleSize) {
        this.client = client;
        this.sampleSize = sampleSize;
    }

    public VerificationReport verify(MergedGraph graph) {
        OptionalLong vertices = client.count(GremlinQueries.countVerticesWithLabel(LineageSchema.VERTEX_LABEL));

        Map<String, OptionalLong> bySourceType = new LinkedHashMap<>();
        for (String label : graph.provenanceLabels()) {
            bySourceType.put(label, client.count(GremlinQueries.countVerticesWithLabel(
                    LineageSchema.VERTEX_LABEL, LineageSchema.SOURCE_TYPE_PROPERTY, label)));
        }

        OptionalLong edges = client.count(GremlinQueries.countEdgesWithLabel(LineageSchema.EDGE_LABEL));
        OptionalLong crossSystem = client.count(GremlinQueries.countEdgesWithLabel(
                LineageSchema.EDGE_LABEL, LineageSchema.EDGE_TYPE_PROPERTY, EdgeType.CROSS_SYSTEM.wireValue()));
        List<VertexSample> sample = client.sample(sampleSize);

        OptionalLong columns = client.count(GremlinQueries.countVerticesWithLabel(LineageSchema.COLUMN_LABEL));
        OptionalLong columnEdges = client.count(GremlinQueries.countEdgesWithLabel(LineageSchema.COLUMN_LINEAGE_LABEL));

        VerificationReport report = new VerificationReport(vertices, bySourceType, edges, crossSystem, sample,
                columns, columnEdges);
        logReport(graph, report);
        return report;
    }

    private void logReport(MergedGraph graph, VerificationReport report) {
        log.info("verify.counts vertices={} expectedVertices={} edges={} expectedEdges={} crossSystem={}",
                format(report.vertexCount()), graph.nodeCount(),
                format(report.edgeCount()), graph.edgeCount(),
                format(report.crossSystemEdgeCount()));
        log.info("verify.columns columns={} expectedColumns={} columnLineageEdges={} expectedColumnLineageEdges={}",
                format(report.columnCount()), graph.columnCount(),
                format(report.columnLineageEdgeCount()), graph.columnMappingCount());
        report.verticesBySourceType().forEach((label, count) ->
                log.info("verify.sourceType label={} vertices={}", label, format(count)));
        report.sample().forEach(s -> log.info("verify.sample name={} source={}", s.name(), s.sourceType()));
        if (report.isComplete() && !report.matches(graph.nodeCount(), graph.edgeCount())) {
            log.warn("Stored graph differs from merged graph");
        }
    }

    private static String format(OptionalLong value) {
        return value.isPresent() ? Long.toString(value.getAsLong()) : "n/a";
    }
}
