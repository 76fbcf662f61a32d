package com.lineage.sync.sync;

/**
 * Write state of a vertex or edge within one run.
 *
 * <pre>
 * NOT_ATTEMPTED -> IN_FLIGHT -> SUCCEEDED | FAILED
 * FAILED -> (recovery pass) -> SUCCEEDED | STILL_FAILED
 * </pre>
 */
public enum EntityState {
    NOT_ATTEMPTED,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    STILL_FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == STILL_FAILED;
    }
}
