package com.lineage.sync.verify;

import com.lineage.sync.graph.VertexSample;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Counts read back from the store after a run. A count that could not be
 * fetched is empty.
 *
 * @param vertexCount             lineage node vertices
 * @param verticesBySourceType    lineage node vertices per provenance label present in the merged graph
 * @param edgeCount               data flow edges
 * @param crossSystemEdgeCount    data flow edges typed cross-system
 * @param sample                  a few stored (name, provenance label) pairs
 * @param columnCount             column vertices
 * @param columnLineageEdgeCount  column lineage edges
 */
public record VerificationReport(
        OptionalLong vertexCount,
        Map<String, OptionalLong> verticesBySourceType,
        OptionalLong edgeCount,
        OptionalLong crossSystemEdgeCount,
        List<VertexSample> sample,
        OptionalLong columnCount,
        OptionalLong columnLineageEdgeCount
) {
    public VerificationReport {
        verticesBySourceType = verticesBySourceType != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(verticesBySourceType)) : Map.of();
        sample = sample != null ? List.copyOf(sample) : List.of();
        columnCount = columnCount != null ? columnCount : OptionalLong.empty();
        columnLineageEdgeCount = columnLineageEdgeCount != null ? columnLineageEdgeCount : OptionalLong.empty();
    }

    /**
     * True when every count was fetched.
     */
    public boolean isComplete() {
        return vertexCount.isPresent() && edgeCount.isPresent() && crossSystemEdgeCount.isPresent()
                && columnCount.isPresent() && columnLineageEdgeCount.isPresent()
                && verticesBySourceType.values().stream().allMatch(OptionalLong::isPresent);
    }

    /**
     * True when the stored node and data flow edge totals equal the expected ones.
     */
    public boolean matches(long expectedVertices, long expectedEdges) {
        return vertexCount.isPresent() && vertexCount.getAsLong() == expectedVertices
                && edgeCount.isPresent() && edgeCount.getAsLong() == expectedEdges;
    }
}
