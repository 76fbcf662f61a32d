package com.lineage.sync.sync;

import java.util.List;

/**
 * Outcome of the recovery pass.
 *
 * @param attempted  number of pending operations replayed
 * @param recovered  number that succeeded on replay
 * @param unresolved operations that still failed, in recording order
 */
public record RecoveryResult(int attempted, int recovered, List<PendingOperation> unresolved) {

    public RecoveryResult {
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
    }

    public static RecoveryResult skipped(List<PendingOperation> pending) {
        return new RecoveryResult(0, 0, pending);
    }
}
