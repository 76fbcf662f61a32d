package com.lineage.sync.sync;

/**
 * Result of the write phase: statistics plus what the recovery pass left behind.
 *
 * @param statistics aggregate figures
 * @param recovery   recovery pass outcome; skipped when the run was cancelled
 */
public record SyncResult(SyncStatistics statistics, RecoveryResult recovery) {
}
