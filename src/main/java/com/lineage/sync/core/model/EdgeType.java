package com.lineage.sync.core.model;

/**
 * Type of a lineage edge, derived from its endpoints' provenance.
 */
public enum EdgeType {
    SAME_SYSTEM("same_system"),
    CROSS_SYSTEM("cross_system");

    private final String wireValue;

    EdgeType(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value stored in the {@code edge_type} edge property.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Cross-system iff the provenance sets differ. A subset counts as different.
     */
    public static EdgeType between(Provenance parent, Provenance child) {
        return parent.equals(child) ? SAME_SYSTEM : CROSS_SYSTEM;
    }
}
