package com.lineage.sync.graph;

import com.lineage.sync.core.LineageSyncException;

/**
 * Base class for failures of a single query against the graph store.
 */
public abstract class GraphQueryException extends LineageSyncException {

    protected GraphQueryException(String message) {
        super(message);
    }

    protected GraphQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
