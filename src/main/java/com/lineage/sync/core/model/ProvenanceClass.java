package com.lineage.sync.core.model;

/**
 * Classification of a node by how many sources reported it.
 */
public enum ProvenanceClass {
    /** Reported by exactly one source. */
    SOURCE_ONLY,
    /** Reported by more than one source. */
    SHARED,
    /** Not claimed by any source. */
    UNKNOWN;

    public static ProvenanceClass of(Provenance provenance) {
        if (provenance.isUnknown()) {
            return UNKNOWN;
        }
        return provenance.isShared() ? SHARED : SOURCE_ONLY;
    }
}
