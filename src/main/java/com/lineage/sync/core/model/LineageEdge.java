package com.lineage.sync.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A directed data-flow edge from a parent dataset to a child dataset.
 * Edges are unique by (parent, child).
 *
 * @param parent            parent node id
 * @param child             child node id
 * @param parentProvenance  provenance of the parent node
 * @param childProvenance   provenance of the child node
 * @param createdAt         creation timestamp
 */
public record LineageEdge(
        String parent,
        String child,
        Provenance parentProvenance,
        Provenance childProvenance,
        Instant createdAt
) {
    public LineageEdge {
        Objects.requireNonNull(parent, "parent is required");
        Objects.requireNonNull(child, "child is required");
        Objects.requireNonNull(parentProvenance, "parentProvenance is required");
        Objects.requireNonNull(childProvenance, "childProvenance is required");
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public EdgeType edgeType() {
        return EdgeType.between(parentProvenance, childProvenance);
    }

    /**
     * Identity key of the edge, {@code parent->child}.
     */
    public String key() {
        return keyOf(parent, child);
    }

    public static String keyOf(String parent, String child) {
        return parent + "->" + child;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineageEdge that)) return false;
        return parent.equals(that.parent) && child.equals(that.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child);
    }
}
