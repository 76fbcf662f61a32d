package com.lineage.sync.merge;

import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.LineageColumn;
import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.core.model.Provenance;
import com.lineage.sync.core.model.SourceLineage;
import com.lineage.sync.manifest.ManifestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the adjacency maps of several sources into one provenance-tagged graph.
 *
 * <p>Sources are processed in the given order. Every parent and child seen in
 * a source gets that source's tag added to its provenance. Children are
 * appended only when not already present, so the first source to report an
 * edge fixes its position in the child list. Attributes of the same node
 * coming from several sources are merged key by key, later source winning.</p>
 *
 * <p>Columns are merged alongside: a column's provenance is the union of the
 * sources that declared it or referenced it in a column mapping, its
 * metadata is merged key by key with the later source winning, and a mapping
 * reported by several sources is kept once with the first source's
 * transformation.</p>
 *
 * <p>Provenance and node sets do not depend on source order; child-list
 * order does, deterministically.</p>
 */
public class LineageMerger {
    private static final Logger log = LoggerFactory.getLogger(LineageMerger.class);

    private final Clock clock;

    public LineageMerger() {
        this(Clock.systemUTC());
    }

    public LineageMerger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Merges the given sources.
     *
     * @throws ManifestException if fewer than two sources are given or a
     *                           source tag repeats
     */
    public MergedGraph merge(List<SourceLineage> sources) {
        if (sources == null || sources.size() < 2) {
            throw new ManifestException("At least two sources are required to merge, got " +
                    (sources == null ? 0 : sources.size()));
        }

        Set<String> seenTags = new HashSet<>();
        List<String> sourceTags = new ArrayList<>(sources.size());
        Map<String, LinkedHashSet<String>> adjacency = new LinkedHashMap<>();
        Map<String, Provenance> provenance = new LinkedHashMap<>();
        Map<String, Map<String, Object>> attributes = new LinkedHashMap<>();
        Map<ColumnKey, Provenance> columnProvenance = new LinkedHashMap<>();
        Map<ColumnKey, Map<String, Object>> columnAttributes = new LinkedHashMap<>();
        Set<ColumnMapping> columnMappings = new LinkedHashSet<>();

        for (SourceLineage source : sources) {
            String tag = source.getSourceTag();
            if (!seenTags.add(tag)) {
                throw new ManifestException("Duplicate source tag: " + tag);
            }
            sourceTags.add(tag);
            Provenance tagProvenance = Provenance.of(tag);

            source.getAdjacency().forEach((parent, children) -> {
                LinkedHashSet<String> merged = adjacency.computeIfAbsent(parent, k -> new LinkedHashSet<>());
                provenance.merge(parent, tagProvenance, Provenance::union);
                for (String child : children) {
                    merged.add(child);
                    provenance.merge(child, tagProvenance, Provenance::union);
                }
            });

            source.getAttributes().forEach((node, attrs) ->
                    attributes.computeIfAbsent(node, k -> new LinkedHashMap<>()).putAll(attrs));

            source.getColumns().forEach((column, attrs) -> {
                columnProvenance.merge(column, tagProvenance, Provenance::union);
                Map<String, Object> merged = columnAttributes.computeIfAbsent(column, k -> new LinkedHashMap<>());
                attrs.forEach((key, value) -> {
                    if (value != null) {
                        merged.put(key, value);
                    }
                });
            });
            for (ColumnMapping mapping : source.getColumnMappings()) {
                columnMappings.add(mapping);
                columnProvenance.merge(mapping.source(), tagProvenance, Provenance::union);
                columnProvenance.merge(mapping.target(), tagProvenance, Provenance::union);
            }

            log.debug("Merged source '{}' ({} parent entries)", tag, source.nodeCount());
        }

        // close the graph: leaves referenced only as children get an entry
        List<String> referencedOnly = new ArrayList<>();
        adjacency.values().forEach(children -> children.stream()
                .filter(child -> !adjacency.containsKey(child))
                .forEach(referencedOnly::add));
        referencedOnly.forEach(child -> adjacency.putIfAbsent(child, new LinkedHashSet<>()));

        Map<String, List<String>> finalAdjacency = new LinkedHashMap<>();
        adjacency.forEach((node, children) -> finalAdjacency.put(node, new ArrayList<>(children)));

        // attributes for nodes outside the graph cannot be written anywhere
        attributes.keySet().retainAll(finalAdjacency.keySet());

        Map<ColumnKey, LineageColumn> columns = new LinkedHashMap<>();
        columnProvenance.forEach((column, columnTags) -> columns.put(column,
                new LineageColumn(column, columnTags, columnAttributes.get(column))));

        MergedGraph graph = new MergedGraph(sourceTags, finalAdjacency, provenance, attributes, clock.instant(),
                columns, new ArrayList<>(columnMappings));

        log.info("merge.completed sources={} nodes={} edges={} shared={} unknown={} crossSystemEdges={}",
                sourceTags.size(), graph.nodeCount(), graph.edgeCount(), graph.sharedCount(),
                graph.unknownCount(), graph.crossSystemEdgeCount());
        if (graph.columnCount() > 0) {
            log.info("merge.columns columns={} attached={} columnMappings={}",
                    graph.columnCount(), graph.attachedColumnCount(), graph.columnMappingCount());
        }
        graph.sourceOnlyCounts().forEach((tag, count) ->
                log.info("merge.sourceOnly source={} nodes={}", tag, count));
        return graph;
    }
}
