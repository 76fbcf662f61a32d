package com.lineage.sync.sync;

import com.lineage.sync.core.LineageSyncException;

/**
 * The graph store could not be cleared before writing. Aborts the run.
 */
public class GraphClearException extends LineageSyncException {

    public GraphClearException(String message) {
        super(message);
    }

    public GraphClearException(String message, Throwable cause) {
        super(message, cause);
    }
}
