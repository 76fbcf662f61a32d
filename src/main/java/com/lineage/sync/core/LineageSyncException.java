package com.lineage.sync.core;

/**
 * Base runtime exception for lineage synchronization failures.
 */
public class LineageSyncException extends RuntimeException {

    public LineageSyncException(String message) {
        super(message);
    }

    public LineageSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
