package com.lineage.sync.sync;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate figures of a synchronization run, produced whether or not every
 * write succeeded.
 *
 * @param totalNodes        nodes in the merged graph
 * @param totalEdges        edges in the merged graph
 * @param sourceOnlyCounts  nodes reported by exactly one source, per source tag
 * @param sharedNodes       nodes reported by more than one source
 * @param unknownNodes      nodes no source claimed
 * @param crossSystemEdges  edges whose endpoints have different provenance
 * @param verticesUpserted  vertex upserts accepted by the store
 * @param edgesUpserted     edge upserts accepted by the store
 * @param conflictRetries   inline retries caused by conflicts
 * @param recovered         failed operations that succeeded in the recovery pass
 * @param failures          operations still failed after the recovery pass
 * @param elapsed           wall-clock time of the write phase
 * @param cancelled         whether the run was interrupted
 * @param totalColumns      columns in the merged graph
 * @param totalColumnMappings column lineage mappings in the merged graph
 * @param columnsUpserted   column vertex upserts accepted by the store
 * @param columnEdgesUpserted membership and column lineage edge upserts accepted by the store
 */
public record SyncStatistics(
        int totalNodes,
        int totalEdges,
        Map<String, Integer> sourceOnlyCounts,
        int sharedNodes,
        int unknownNodes,
        int crossSystemEdges,
        long verticesUpserted,
        long edgesUpserted,
        long conflictRetries,
        int recovered,
        int failures,
        Duration elapsed,
        boolean cancelled,
        int totalColumns,
        int totalColumnMappings,
        long columnsUpserted,
        long columnEdgesUpserted
) {
    /**
     * Statistics of a run without column lineage.
     */
    public SyncStatistics(int totalNodes, int totalEdges, Map<String, Integer> sourceOnlyCounts,
                          int sharedNodes, int unknownNodes, int crossSystemEdges,
                          long verticesUpserted, long edgesUpserted, long conflictRetries,
                          int recovered, int failures, Duration elapsed, boolean cancelled) {
        this(totalNodes, totalEdges, sourceOnlyCounts, sharedNodes, unknownNodes, crossSystemEdges,
                verticesUpserted, edgesUpserted, conflictRetries, recovered, failures, elapsed, cancelled,
                0, 0, 0, 0);
    }

    public SyncStatistics {
        sourceOnlyCounts = sourceOnlyCounts != null
                ? Collections.unmodifiableMap(new TreeMap<>(sourceOnlyCounts))
                : Collections.emptySortedMap();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    /**
     * Edges upserted per second of elapsed time; 0 when no time elapsed.
     */
    public double throughput() {
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        return seconds > 0 ? edgesUpserted / seconds : 0.0;
    }

    public boolean hasFailures() {
        return failures > 0;
    }

    @Override
    public String toString() {
        return "SyncStatistics{nodes=" + totalNodes +
                ", edges=" + totalEdges +
                ", shared=" + sharedNodes +
                ", edgesUpserted=" + edgesUpserted +
                ", columns=" + totalColumns +
                ", columnMappings=" + totalColumnMappings +
                ", conflictRetries=" + conflictRetries +
                ", recovered=" + recovered +
                ", failures=" + failures +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                ", cancelled=" + cancelled + '}';
    }
}
