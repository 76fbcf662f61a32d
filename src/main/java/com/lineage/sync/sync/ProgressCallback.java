package com.lineage.sync.sync;

/**
 * Receives progress of the main write pass, once per completed batch.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed  work units (nodes, then columns) processed so far
     * @param total      work units in the graph
     * @param batch      1-based index of the batch just completed
     * @param batchTotal number of batches
     */
    void onProgress(long processed, long total, int batch, int batchTotal);

    ProgressCallback NOOP = (processed, total, batch, batchTotal) -> {};
}
