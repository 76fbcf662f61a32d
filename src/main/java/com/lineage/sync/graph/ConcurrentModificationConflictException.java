package com.lineage.sync.graph;

/**
 * The store rejected a write because a concurrent writer modified overlapping
 * state. The only failure the endpoint client retries inline.
 */
public class ConcurrentModificationConflictException extends GraphQueryException {

    public ConcurrentModificationConflictException(String message) {
        super(message);
    }
}
