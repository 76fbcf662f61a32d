package com.lineage.sync.sync;

import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.graph.GremlinQueries;
import com.lineage.sync.graph.NeptuneEndpointClient;
import com.lineage.sync.graph.QueryOutcome;
import com.lineage.sync.graph.Sleeper;
import com.lineage.sync.logging.LogContext;
import com.lineage.sync.metrics.MetricsService;
import com.lineage.sync.metrics.NoOpMetricsService;
import com.lineage.sync.tracing.NoOpTracingService;
import com.lineage.sync.tracing.Span;
import com.lineage.sync.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Replicates a merged graph into the store.
 *
 * <p>The run clears the store, then writes units in fixed-size batches. Units
 * of one batch run concurrently on a fixed worker pool; batches run one after
 * another with a pacing pause in between. A node unit upserts a node's vertex
 * and then its outgoing edges. Column units follow the node units: each
 * upserts a column vertex, its {@code has_column} edge and its outgoing
 * column lineage edges. Failures are recorded in the session's recovery
 * queue, which is drained once after the last batch.</p>
 *
 * <p>If the calling thread is interrupted, the batch in progress is allowed
 * to finish, no further batch starts, the recovery pass is skipped and the
 * statistics are marked cancelled. The interrupt flag is left set.</p>
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final NeptuneEndpointClient client;
    private final SyncOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ProgressCallback progressCallback;
    private final Sleeper sleeper;

    private BatchScheduler(Builder builder) {
        this.client = builder.client;
        this.options = builder.options != null ? builder.options : SyncOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.progressCallback = builder.progressCallback != null ? builder.progressCallback : ProgressCallback.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    }

    /**
     * Clears the store (when enabled), writes every node and edge, then runs
     * the recovery pass.
     *
     * @throws GraphClearException if the store cannot be cleared
     */
    public SyncResult synchronize(MergedGraph graph, SyncSession session) {
        long start = System.nanoTime();
        LineageGraphWriter writer = new LineageGraphWriter(client, graph, session, metricsService);

        if (options.isClearBeforeSync()) {
            clear();
        }

        boolean cancelled = runMainPass(graph, session, writer);

        RecoveryResult recovery;
        if (cancelled) {
            recovery = RecoveryResult.skipped(session.getRecoveryQueue().snapshot());
            log.warn("Run cancelled; skipping recovery with {} pending operations", recovery.unresolved().size());
        } else {
            recovery = runRecovery(session, writer);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        SyncStatistics statistics = new SyncStatistics(
                graph.nodeCount(),
                graph.edgeCount(),
                graph.sourceOnlyCounts(),
                graph.sharedCount(),
                graph.unknownCount(),
                graph.crossSystemEdgeCount(),
                session.getVerticesUpserted(),
                session.getEdgesUpserted(),
                session.getConflictRetries(),
                recovery.recovered(),
                recovery.unresolved().size(),
                elapsed,
                cancelled,
                graph.columnCount(),
                graph.columnMappingCount(),
                session.getColumnsUpserted(),
                session.getColumnEdgesUpserted());
        logSummary(statistics);
        return new SyncResult(statistics, recovery);
    }

    private void clear() {
        log.info("Clearing existing graph at {}", client.describe());
        QueryOutcome outcome = client.clearGraph();
        if (!outcome.isSuccess()) {
            throw new GraphClearException("Could not clear graph before sync: " + outcome.describe(),
                    outcome.error());
        }
        OptionalLong remaining = client.count(GremlinQueries.countVertices());
        if (remaining.isPresent()) {
            log.info("graph.cleared remainingVertices={}", remaining.getAsLong());
        } else {
            log.info("graph.cleared remainingVertices=unknown");
        }
    }

    // ========== Main pass ==========

    private boolean runMainPass(MergedGraph graph, SyncSession session, LineageGraphWriter writer) {
        List<IntConsumer> units = new ArrayList<>(graph.nodeCount() + graph.columnCount());
        for (String nodeId : graph.nodeIds()) {
            units.add(batchIndex -> runNodeUnit(graph, session, writer, nodeId, batchIndex));
        }
        for (ColumnKey column : graph.getColumns().keySet()) {
            units.add(batchIndex -> runColumnUnit(graph, session, writer, column, batchIndex));
        }
        int batchSize = options.getBatchSize();
        int batchTotal = (units.size() + batchSize - 1) / batchSize;
        log.info("sync.started runId={} nodes={} edges={} columns={} columnMappings={} batches={} workers={}",
                session.getRunId(), graph.nodeCount(), graph.edgeCount(), graph.columnCount(),
                graph.columnMappingCount(), batchTotal, options.getWorkerCount());

        ExecutorService executor = Executors.newFixedThreadPool(options.getWorkerCount(),
                workerThreadFactory(session.getRunId()));
        boolean cancelled = false;
        long processed = 0;
        try {
            for (int batch = 0; batch < batchTotal; batch++) {
                if (Thread.currentThread().isInterrupted()) {
                    cancelled = true;
                    break;
                }
                List<IntConsumer> slice = units.subList(batch * batchSize, Math.min(units.size(), (batch + 1) * batchSize));
                cancelled = runBatch(executor, slice, batch + 1, batchTotal);
                processed += slice.size();
                progressCallback.onProgress(processed, units.size(), batch + 1, batchTotal);
                log.info("batch.completed batch={}/{} processed={}/{}", batch + 1, batchTotal, processed, units.size());
                if (cancelled) {
                    break;
                }
                if (batch + 1 < batchTotal && !options.getBatchPacing().isZero()) {
                    try {
                        sleeper.sleep(options.getBatchPacing());
                    } catch (InterruptedException e) {
                        cancelled = true;
                        break;
                    }
                }
            }
        } finally {
            shutdown(executor);
        }

        if (cancelled) {
            Thread.currentThread().interrupt();
            log.warn("sync.cancelled processed={}/{}", processed, units.size());
        }
        return cancelled;
    }

    /**
     * Runs one batch and waits for every unit, even when interrupted.
     *
     * @return true if the calling thread was interrupted while waiting
     */
    private boolean runBatch(ExecutorService executor, List<IntConsumer> slice, int batchIndex, int batchTotal) {
        metricsService.recordBatchSize(slice.size());
        boolean interrupted = false;
        try (Span span = tracingService.startSpan(TracingService.BATCH_SPAN,
                Map.of("batch.index", batchIndex, "batch.total", batchTotal, "batch.size", slice.size()))) {
            List<Future<?>> futures = new ArrayList<>(slice.size());
            for (IntConsumer unit : slice) {
                futures.add(executor.submit(() -> unit.accept(batchIndex)));
            }
            for (Future<?> future : futures) {
                while (true) {
                    try {
                        future.get();
                        break;
                    } catch (InterruptedException e) {
                        // keep draining the batch; cancellation takes effect afterwards
                        interrupted = true;
                    } catch (ExecutionException e) {
                        log.error("Work unit terminated abnormally", e.getCause());
                        break;
                    }
                }
            }
            span.setStatus(Span.SpanStatus.OK);
        }
        return interrupted;
    }

    private void runNodeUnit(MergedGraph graph, SyncSession session, LineageGraphWriter writer,
                             String nodeId, int batchIndex) {
        RecoveryQueue queue = session.getRecoveryQueue();
        try (LogContext ctx = LogContext.forBatch(session.getRunId(), batchIndex)) {
            List<String> children = graph.children(nodeId);
            try {
                if (!writer.writeVertex(nodeId)) {
                    queue.record(new PendingOperation.NodeRetry(nodeId, children));
                    return;
                }
                for (String child : children) {
                    if (!writer.writeEdge(nodeId, child)) {
                        queue.record(new PendingOperation.EdgeRetry(nodeId, child,
                                graph.provenanceOf(nodeId).label(), graph.provenanceOf(child).label()));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure writing node {}", nodeId, e);
                queue.record(new PendingOperation.NodeRetry(nodeId, children));
            }
        }
    }

    private void runColumnUnit(MergedGraph graph, SyncSession session, LineageGraphWriter writer,
                               ColumnKey column, int batchIndex) {
        RecoveryQueue queue = session.getRecoveryQueue();
        try (LogContext ctx = LogContext.forBatch(session.getRunId(), batchIndex)) {
            try {
                if (!writer.writeColumn(column) || !writer.writeColumnMembership(column)) {
                    queue.record(new PendingOperation.ColumnRetry(column));
                    return;
                }
                for (ColumnMapping mapping : graph.mappingsFrom(column)) {
                    if (!writer.writeColumnEdge(mapping)) {
                        queue.record(new PendingOperation.ColumnEdgeRetry(mapping));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure writing column {}", column, e);
                queue.record(new PendingOperation.ColumnRetry(column));
            }
        }
    }

    // ========== Recovery pass ==========

    private RecoveryResult runRecovery(SyncSession session, LineageGraphWriter writer) {
        session.enterRecoveryPhase();
        try (LogContext ctx = LogContext.forRecovery(session.getRunId());
             Span span = tracingService.startSpan(TracingService.RECOVERY_SPAN,
                     Map.of("pending", session.getRecoveryQueue().size()))) {
            RecoveryResult result = session.getRecoveryQueue().drain(writer::replay);
            for (int i = 0; i < result.recovered(); i++) {
                metricsService.incrementRecovered();
            }
            span.setAttribute("recovered", result.recovered());
            span.setAttribute("unresolved", result.unresolved().size());
            span.setStatus(result.unresolved().isEmpty() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            return result;
        }
    }

    // ========== Helpers ==========

    private void logSummary(SyncStatistics stats) {
        log.info("========== Lineage sync summary ==========");
        log.info("Total nodes:          {}", stats.totalNodes());
        stats.sourceOnlyCounts().forEach((tag, count) ->
                log.info("{}-only nodes: {}", tag, count));
        log.info("Shared nodes:         {}", stats.sharedNodes());
        log.info("Unknown nodes:        {}", stats.unknownNodes());
        log.info("Edges upserted:       {}/{}", stats.edgesUpserted(), stats.totalEdges());
        if (stats.totalColumns() > 0) {
            log.info("Columns upserted:     {}/{}", stats.columnsUpserted(), stats.totalColumns());
            log.info("Column mappings:      {}", stats.totalColumnMappings());
            log.info("Column edges upserted: {}", stats.columnEdgesUpserted());
        }
        log.info("Cross-system edges:   {}", stats.crossSystemEdges());
        log.info("Conflict retries:     {}", stats.conflictRetries());
        log.info("Recovered:            {}", stats.recovered());
        log.info("Unresolved failures:  {}", stats.failures());
        log.info("Elapsed:              {} ms ({} edges/s)", stats.elapsed().toMillis(),
                String.format("%.2f", stats.throughput()));
        if (stats.cancelled()) {
            log.info("Run was cancelled before completion");
        }
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "lineage-sync-" + runId.substring(0, Math.min(8, runId.length())) + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NeptuneEndpointClient client;
        private SyncOptions options;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ProgressCallback progressCallback;
        private Sleeper sleeper;

        public Builder client(NeptuneEndpointClient client) {
            this.client = client;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        /**
         * Used for the pause between batches.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public BatchScheduler build() {
            if (client == null) {
                throw new IllegalStateException("client is required");
            }
            return new BatchScheduler(this);
        }
    }
}
