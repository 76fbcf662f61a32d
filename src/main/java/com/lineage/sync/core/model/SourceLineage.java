package com.lineage.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adjacency map reported by a single source system, with optional per-node
 * scalar attributes and optional column-level lineage.
 */
public final class SourceLineage {

    private final String sourceTag;
    private final Map<String, List<String>> adjacency;
    private final Map<String, Map<String, Object>> attributes;
    private final Map<ColumnKey, Map<String, Object>> columns;
    private final List<ColumnMapping> columnMappings;

    private SourceLineage(String sourceTag, Map<String, List<String>> adjacency,
                          Map<String, Map<String, Object>> attributes,
                          Map<ColumnKey, Map<String, Object>> columns,
                          List<ColumnMapping> columnMappings) {
        if (sourceTag == null || sourceTag.isBlank()) {
            throw new IllegalArgumentException("sourceTag must not be null or blank");
        }
        if (Provenance.UNKNOWN_TAG.equals(sourceTag)) {
            throw new IllegalArgumentException("'" + Provenance.UNKNOWN_TAG + "' is reserved and cannot be a source tag");
        }
        Objects.requireNonNull(adjacency, "adjacency is required");
        this.sourceTag = sourceTag;

        Map<String, List<String>> adjacencyCopy = new LinkedHashMap<>();
        adjacency.forEach((node, children) -> adjacencyCopy.put(node,
                children != null ? Collections.unmodifiableList(new ArrayList<>(children)) : List.of()));
        this.adjacency = Collections.unmodifiableMap(adjacencyCopy);

        Map<String, Map<String, Object>> attributeCopy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((node, attrs) -> attributeCopy.put(node,
                    Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
        }
        this.attributes = Collections.unmodifiableMap(attributeCopy);

        Map<ColumnKey, Map<String, Object>> columnCopy = new LinkedHashMap<>();
        if (columns != null) {
            columns.forEach((key, attrs) -> columnCopy.put(key, attrs != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(attrs)) : Map.of()));
        }
        this.columns = Collections.unmodifiableMap(columnCopy);
        this.columnMappings = columnMappings != null ? List.copyOf(columnMappings) : List.of();
    }

    public static SourceLineage of(String sourceTag, Map<String, List<String>> adjacency) {
        return new SourceLineage(sourceTag, adjacency, Map.of(), Map.of(), List.of());
    }

    public static SourceLineage of(String sourceTag, Map<String, List<String>> adjacency,
                                   Map<String, Map<String, Object>> attributes) {
        return new SourceLineage(sourceTag, adjacency, attributes, Map.of(), List.of());
    }

    public static SourceLineage of(String sourceTag, Map<String, List<String>> adjacency,
                                   Map<String, Map<String, Object>> attributes,
                                   Map<ColumnKey, Map<String, Object>> columns,
                                   List<ColumnMapping> columnMappings) {
        return new SourceLineage(sourceTag, adjacency, attributes, columns, columnMappings);
    }

    public String getSourceTag() {
        return sourceTag;
    }

    /**
     * Node to children, in document order.
     */
    public Map<String, List<String>> getAdjacency() {
        return adjacency;
    }

    public Map<String, Map<String, Object>> getAttributes() {
        return attributes;
    }

    /**
     * Columns declared by the source's schemas, with their metadata.
     */
    public Map<ColumnKey, Map<String, Object>> getColumns() {
        return columns;
    }

    /**
     * Column-level data flows, in document order.
     */
    public List<ColumnMapping> getColumnMappings() {
        return columnMappings;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    @Override
    public String toString() {
        return "SourceLineage{source='" + sourceTag + "', nodes=" + adjacency.size() + '}';
    }
}
