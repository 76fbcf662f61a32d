package com.lineage.sync.manifest;

import com.lineage.sync.core.LineageSyncException;

/**
 * Thrown when a source document is missing or malformed.
 * Always fatal: the run aborts before any write to the graph store.
 */
public class ManifestException extends LineageSyncException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
