package com.lineage.sync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the merged lineage graph, as written to the graph store.
 */
public final class LineageNode {

    private final String id;
    private final Provenance provenance;
    private final List<String> children;
    private final Map<String, Object> attributes;
    private final Instant createdAt;

    public LineageNode(String id, Provenance provenance, List<String> children,
                       Map<String, Object> attributes, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.provenance = Objects.requireNonNull(provenance, "provenance is required");
        this.children = children != null ? List.copyOf(children) : List.of();
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public List<String> getChildren() {
        return children;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ProvenanceClass getProvenanceClass() {
        return ProvenanceClass.of(provenance);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LineageNode that = (LineageNode) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "LineageNode{" +
                "id='" + id + '\'' +
                ", provenance=" + provenance.label() +
                ", children=" + children.size() +
                '}';
    }
}
