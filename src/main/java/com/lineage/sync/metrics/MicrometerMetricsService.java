package com.lineage.sync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lineage.sync.query.duration}: Timer (tags: kind, outcome)</li>
 *   <li>{@code lineage.sync.vertex.upserted}: Counter</li>
 *   <li>{@code lineage.sync.edge.upserted}: Counter</li>
 *   <li>{@code lineage.sync.conflict.retries}: Counter</li>
 *   <li>{@code lineage.sync.failures}: Counter (tag: entity)</li>
 *   <li>{@code lineage.sync.recovered}: Counter</li>
 *   <li>{@code lineage.sync.run.duration}: Timer</li>
 *   <li>{@code lineage.sync.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Counter vertexUpsertedCounter;
    private final Counter edgeUpsertedCounter;
    private final Counter conflictRetryCounter;
    private final Counter recoveredCounter;
    private final Timer runTimer;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.vertexUpsertedCounter = Counter.builder("lineage.sync.vertex.upserted")
                .description("Number of vertex upserts accepted by the store")
                .register(registry);
        this.edgeUpsertedCounter = Counter.builder("lineage.sync.edge.upserted")
                .description("Number of edge upserts accepted by the store")
                .register(registry);
        this.conflictRetryCounter = Counter.builder("lineage.sync.conflict.retries")
                .description("Number of retries caused by concurrent modification conflicts")
                .register(registry);
        this.recoveredCounter = Counter.builder("lineage.sync.recovered")
                .description("Number of failed operations that succeeded in the recovery pass")
                .register(registry);
        this.runTimer = Timer.builder("lineage.sync.run.duration")
                .description("Duration of complete synchronization runs")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("lineage.sync.batch.size")
                .description("Distribution of node batch sizes")
                .register(registry);
    }

    @Override
    public void recordQueryDuration(String queryKind, String outcome, Duration duration) {
        String key = queryKind + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("lineage.sync.query.duration")
                        .description("Duration of queries against the graph store, retries included")
                        .tag("kind", queryKind)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementVertexUpserted() {
        vertexUpsertedCounter.increment();
    }

    @Override
    public void incrementEdgeUpserted() {
        edgeUpsertedCounter.increment();
    }

    @Override
    public void incrementConflictRetry() {
        conflictRetryCounter.increment();
    }

    @Override
    public void incrementFailure(String entityKind) {
        Counter counter = failureCounters.computeIfAbsent(entityKind, k ->
                Counter.builder("lineage.sync.failures")
                        .description("Number of failed writes per entity kind")
                        .tag("entity", entityKind)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRecovered() {
        recoveredCounter.increment();
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
