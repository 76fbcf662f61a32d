package com.lineage.sync.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The lineage graph produced by merging every source.
 *
 * <p>Built once per run and read-only afterwards. Every id that appears as a
 * child is also a key (leaf nodes map to an empty child list) and every node
 * has a non-empty provenance. Column lineage is closed the same way: both
 * ends of every column mapping are columns of the graph.</p>
 */
public final class MergedGraph {

    private final List<String> sourceTags;
    private final Map<String, List<String>> adjacency;
    private final Map<String, Provenance> provenance;
    private final Map<String, Map<String, Object>> attributes;
    private final Instant createdAt;
    private final Map<ColumnKey, LineageColumn> columns;
    private final List<ColumnMapping> columnMappings;
    private final Map<ColumnKey, List<ColumnMapping>> mappingsBySource;

    public MergedGraph(List<String> sourceTags,
                       Map<String, List<String>> adjacency,
                       Map<String, Provenance> provenance,
                       Map<String, Map<String, Object>> attributes,
                       Instant createdAt) {
        this(sourceTags, adjacency, provenance, attributes, createdAt, Map.of(), List.of());
    }

    public MergedGraph(List<String> sourceTags,
                       Map<String, List<String>> adjacency,
                       Map<String, Provenance> provenance,
                       Map<String, Map<String, Object>> attributes,
                       Instant createdAt,
                       Map<ColumnKey, LineageColumn> columns,
                       List<ColumnMapping> columnMappings) {
        this.sourceTags = List.copyOf(Objects.requireNonNull(sourceTags, "sourceTags is required"));
        Objects.requireNonNull(adjacency, "adjacency is required");
        Objects.requireNonNull(provenance, "provenance is required");

        Map<String, List<String>> adjacencyCopy = new LinkedHashMap<>();
        adjacency.forEach((node, children) -> adjacencyCopy.put(node, List.copyOf(children)));
        this.adjacency = Collections.unmodifiableMap(adjacencyCopy);

        Map<String, Provenance> provenanceCopy = new LinkedHashMap<>();
        for (String node : adjacencyCopy.keySet()) {
            Provenance p = provenance.get(node);
            provenanceCopy.put(node, p != null ? p : Provenance.unknown());
        }
        this.provenance = Collections.unmodifiableMap(provenanceCopy);

        Map<String, Map<String, Object>> attributeCopy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((node, attrs) -> attributeCopy.put(node,
                    Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
        }
        this.attributes = Collections.unmodifiableMap(attributeCopy);
        this.createdAt = createdAt != null ? createdAt : Instant.now();

        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns != null ? columns : Map.of()));
        this.columnMappings = columnMappings != null ? List.copyOf(columnMappings) : List.of();
        Map<ColumnKey, List<ColumnMapping>> bySource = new LinkedHashMap<>();
        this.columnMappings.forEach(m -> bySource.computeIfAbsent(m.source(), k -> new ArrayList<>()).add(m));
        Map<ColumnKey, List<ColumnMapping>> bySourceCopy = new LinkedHashMap<>();
        bySource.forEach((key, list) -> bySourceCopy.put(key, List.copyOf(list)));
        this.mappingsBySource = Collections.unmodifiableMap(bySourceCopy);

        verifyClosure();
    }

    private void verifyClosure() {
        for (Map.Entry<String, List<String>> entry : adjacency.entrySet()) {
            for (String child : entry.getValue()) {
                if (!adjacency.containsKey(child)) {
                    throw new IllegalArgumentException(
                            "Child '" + child + "' of '" + entry.getKey() + "' is not a node of the graph");
                }
            }
        }
        for (ColumnMapping mapping : columnMappings) {
            if (!columns.containsKey(mapping.source()) || !columns.containsKey(mapping.target())) {
                throw new IllegalArgumentException(
                        "Column mapping " + mapping.key() + " refers to a column outside the graph");
            }
        }
    }

    public List<String> getSourceTags() {
        return sourceTags;
    }

    /**
     * Node to children, in deterministic insertion order.
     */
    public Map<String, List<String>> getAdjacency() {
        return adjacency;
    }

    public Map<String, Provenance> getProvenance() {
        return provenance;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Set<String> nodeIds() {
        return adjacency.keySet();
    }

    public boolean contains(String nodeId) {
        return adjacency.containsKey(nodeId);
    }

    public List<String> children(String nodeId) {
        List<String> children = adjacency.get(nodeId);
        return children != null ? children : List.of();
    }

    /**
     * Provenance of a node; {@link Provenance#unknown()} for ids outside the graph.
     */
    public Provenance provenanceOf(String nodeId) {
        Provenance p = provenance.get(nodeId);
        return p != null ? p : Provenance.unknown();
    }

    public Map<String, Object> attributesOf(String nodeId) {
        Map<String, Object> attrs = attributes.get(nodeId);
        return attrs != null ? attrs : Map.of();
    }

    public LineageNode node(String nodeId) {
        if (!adjacency.containsKey(nodeId)) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return new LineageNode(nodeId, provenanceOf(nodeId), children(nodeId), attributesOf(nodeId), createdAt);
    }

    public List<LineageNode> nodes() {
        List<LineageNode> nodes = new ArrayList<>(adjacency.size());
        for (String id : adjacency.keySet()) {
            nodes.add(node(id));
        }
        return nodes;
    }

    public LineageEdge edge(String parent, String child) {
        return new LineageEdge(parent, child, provenanceOf(parent), provenanceOf(child), createdAt);
    }

    public List<LineageEdge> edges() {
        List<LineageEdge> edges = new ArrayList<>();
        adjacency.forEach((parent, children) -> {
            for (String child : children) {
                edges.add(edge(parent, child));
            }
        });
        return edges;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(List::size).sum();
    }

    // ========== Columns ==========

    public Map<ColumnKey, LineageColumn> getColumns() {
        return columns;
    }

    public LineageColumn column(ColumnKey key) {
        LineageColumn column = columns.get(key);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + key);
        }
        return column;
    }

    public List<ColumnMapping> getColumnMappings() {
        return columnMappings;
    }

    /**
     * Mappings whose source is the given column, in merge order.
     */
    public List<ColumnMapping> mappingsFrom(ColumnKey source) {
        List<ColumnMapping> mappings = mappingsBySource.get(source);
        return mappings != null ? mappings : List.of();
    }

    /**
     * Whether the column's dataset is a node, so that the column can be
     * attached to it.
     */
    public boolean isAttached(ColumnKey key) {
        return adjacency.containsKey(key.dataset());
    }

    public int columnCount() {
        return columns.size();
    }

    public int columnMappingCount() {
        return columnMappings.size();
    }

    /**
     * Number of columns whose dataset is a node of the graph.
     */
    public int attachedColumnCount() {
        return (int) columns.keySet().stream().filter(this::isAttached).count();
    }

    // ========== Classification ==========

    /**
     * Number of nodes reported by exactly one source, per source tag.
     * Every source tag of the graph is present, with zero where applicable.
     */
    public Map<String, Integer> sourceOnlyCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        sourceTags.forEach(tag -> counts.put(tag, 0));
        provenance.values().stream()
                .filter(p -> ProvenanceClass.of(p) == ProvenanceClass.SOURCE_ONLY)
                .forEach(p -> counts.merge(p.tags().first(), 1, Integer::sum));
        return counts;
    }

    public List<String> sharedNodes() {
        return provenance.entrySet().stream()
                .filter(e -> ProvenanceClass.of(e.getValue()) == ProvenanceClass.SHARED)
                .map(Map.Entry::getKey)
                .toList();
    }

    public int sharedCount() {
        return (int) provenance.values().stream()
                .filter(p -> ProvenanceClass.of(p) == ProvenanceClass.SHARED)
                .count();
    }

    public int unknownCount() {
        return (int) provenance.values().stream().filter(Provenance::isUnknown).count();
    }

    public int crossSystemEdgeCount() {
        return (int) edges().stream().filter(e -> e.edgeType() == EdgeType.CROSS_SYSTEM).count();
    }

    /**
     * Distinct provenance labels present in the graph, sorted.
     */
    public Set<String> provenanceLabels() {
        Set<String> labels = new TreeSet<>();
        provenance.values().forEach(p -> labels.add(p.label()));
        return labels;
    }

    @Override
    public String toString() {
        return "MergedGraph{sources=" + sourceTags +
                ", nodes=" + nodeCount() +
                ", edges=" + edgeCount() +
                ", shared=" + sharedCount() +
                ", columns=" + columns.size() +
                ", columnMappings=" + columnMappings.size() + '}';
    }
}
