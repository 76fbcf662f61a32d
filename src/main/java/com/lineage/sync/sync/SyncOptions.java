package com.lineage.sync.sync;

import com.lineage.sync.graph.BackoffPolicy;
import com.lineage.sync.graph.NeptuneEndpointClient;

import java.time.Duration;

/**
 * Tuning of a synchronization run.
 * Use {@link #builder()} or {@link #defaults()} to create instances.
 */
public class SyncOptions {

    private static final int DEFAULT_BATCH_SIZE = 5;
    private static final int DEFAULT_WORKER_COUNT = 2;
    private static final Duration DEFAULT_BATCH_PACING = Duration.ofMillis(300);
    private static final int DEFAULT_SAMPLE_SIZE = 5;

    private final int batchSize;
    private final int workerCount;
    private final Duration batchPacing;
    private final int vertexMaxAttempts;
    private final int edgeMaxAttempts;
    private final Duration backoffBase;
    private final Duration backoffJitter;
    private final boolean clearBeforeSync;
    private final boolean verifyAfterSync;
    private final boolean writeReports;
    private final int sampleSize;

    private SyncOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.workerCount = builder.workerCount;
        this.batchPacing = builder.batchPacing;
        this.vertexMaxAttempts = builder.vertexMaxAttempts;
        this.edgeMaxAttempts = builder.edgeMaxAttempts;
        this.backoffBase = builder.backoffBase;
        this.backoffJitter = builder.backoffJitter;
        this.clearBeforeSync = builder.clearBeforeSync;
        this.verifyAfterSync = builder.verifyAfterSync;
        this.writeReports = builder.writeReports;
        this.sampleSize = builder.sampleSize;
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getBatchPacing() {
        return batchPacing;
    }

    public int getVertexMaxAttempts() {
        return vertexMaxAttempts;
    }

    public int getEdgeMaxAttempts() {
        return edgeMaxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public Duration getBackoffJitter() {
        return backoffJitter;
    }

    public boolean isClearBeforeSync() {
        return clearBeforeSync;
    }

    public boolean isVerifyAfterSync() {
        return verifyAfterSync;
    }

    public boolean isWriteReports() {
        return writeReports;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SyncOptions{" +
                "batchSize=" + batchSize +
                ", workerCount=" + workerCount +
                ", batchPacing=" + batchPacing.toMillis() + "ms" +
                ", vertexMaxAttempts=" + vertexMaxAttempts +
                ", edgeMaxAttempts=" + edgeMaxAttempts +
                ", clearBeforeSync=" + clearBeforeSync +
                '}';
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int workerCount = DEFAULT_WORKER_COUNT;
        private Duration batchPacing = DEFAULT_BATCH_PACING;
        private int vertexMaxAttempts = NeptuneEndpointClient.DEFAULT_VERTEX_MAX_ATTEMPTS;
        private int edgeMaxAttempts = NeptuneEndpointClient.DEFAULT_EDGE_MAX_ATTEMPTS;
        private Duration backoffBase = BackoffPolicy.DEFAULT_BASE;
        private Duration backoffJitter = BackoffPolicy.DEFAULT_JITTER_BOUND;
        private boolean clearBeforeSync = true;
        private boolean verifyAfterSync = true;
        private boolean writeReports = true;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) throw new IllegalArgumentException("batchSize must be at least 1");
            this.batchSize = batchSize;
            return this;
        }

        public Builder workerCount(int workerCount) {
            if (workerCount < 1) throw new IllegalArgumentException("workerCount must be at least 1");
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Pause between consecutive batches, not after the last one.
         */
        public Builder batchPacing(Duration batchPacing) {
            if (batchPacing == null || batchPacing.isNegative()) {
                throw new IllegalArgumentException("batchPacing must not be negative");
            }
            this.batchPacing = batchPacing;
            return this;
        }

        public Builder vertexMaxAttempts(int vertexMaxAttempts) {
            if (vertexMaxAttempts < 1) throw new IllegalArgumentException("vertexMaxAttempts must be at least 1");
            this.vertexMaxAttempts = vertexMaxAttempts;
            return this;
        }

        public Builder edgeMaxAttempts(int edgeMaxAttempts) {
            if (edgeMaxAttempts < 1) throw new IllegalArgumentException("edgeMaxAttempts must be at least 1");
            this.edgeMaxAttempts = edgeMaxAttempts;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            if (backoffBase == null || backoffBase.isNegative()) {
                throw new IllegalArgumentException("backoffBase must not be negative");
            }
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffJitter(Duration backoffJitter) {
            if (backoffJitter == null || backoffJitter.isNegative()) {
                throw new IllegalArgumentException("backoffJitter must not be negative");
            }
            this.backoffJitter = backoffJitter;
            return this;
        }

        /**
         * Whether to drop every vertex before writing. Enabled by default.
         */
        public Builder clearBeforeSync(boolean clearBeforeSync) {
            this.clearBeforeSync = clearBeforeSync;
            return this;
        }

        public Builder verifyAfterSync(boolean verifyAfterSync) {
            this.verifyAfterSync = verifyAfterSync;
            return this;
        }

        public Builder writeReports(boolean writeReports) {
            this.writeReports = writeReports;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            if (sampleSize < 1) throw new IllegalArgumentException("sampleSize must be at least 1");
            this.sampleSize = sampleSize;
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }
    }
}
