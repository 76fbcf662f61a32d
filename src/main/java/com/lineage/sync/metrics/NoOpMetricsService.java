package com.lineage.sync.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordQueryDuration(String queryKind, String outcome, Duration duration) {
    }

    @Override
    public void incrementVertexUpserted() {
    }

    @Override
    public void incrementEdgeUpserted() {
    }

    @Override
    public void incrementConflictRetry() {
    }

    @Override
    public void incrementFailure(String entityKind) {
    }

    @Override
    public void incrementRecovered() {
    }

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
