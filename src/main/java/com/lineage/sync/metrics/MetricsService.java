package com.lineage.sync.metrics;

import java.time.Duration;

/**
 * Interface for recording synchronization metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordQueryDuration(String queryKind, String outcome, Duration duration);

    void incrementVertexUpserted();

    void incrementEdgeUpserted();

    void incrementConflictRetry();

    void incrementFailure(String entityKind);

    void incrementRecovered();

    void recordRunDuration(Duration duration);

    void recordBatchSize(int size);
}
