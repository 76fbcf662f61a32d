package com.lineage.sync.graph;

/**
 * Network failure, timeout or unexpected server-side error.
 * Not retried inline; the unit is handed to the recovery queue.
 */
public class TransientQueryException extends GraphQueryException {

    public TransientQueryException(String message) {
        super(message);
    }

    public TransientQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
