package com.lineage.sync.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.SourceLineage;
import com.lineage.sync.graph.QuerySanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads per-source lineage documents into {@link SourceLineage} maps.
 *
 * <p>Three layouts are recognized (see {@link ManifestFormat}). Pre-merged
 * lineage maps are taken verbatim. Raw dbt child maps have every identifier
 * passed through the configured normalizer (by default the final
 * dot-separated segment); identifiers that collide after normalization have
 * their children unioned. Raw catalog exports contribute their downstream
 * lists as children, their scalar schema entries as node attributes, their
 * schema fields as columns and their {@code column_lineage} block as column
 * mappings.</p>
 *
 * <p>String attributes longer than {@link QuerySanitizer#MAX_ATTRIBUTE_LENGTH}
 * are truncated. Any missing, unparseable or unrecognized document raises a
 * {@link ManifestException}.</p>
 *
 * <pre>
 * ManifestReader reader = ManifestReader.builder().build();
 * List&lt;SourceLineage&gt; sources = reader.readAll(ManifestSource.discover(dataDir));
 * </pre>
 */
public class ManifestReader {
    private static final Logger log = LoggerFactory.getLogger(ManifestReader.class);

    private static final Map<String, String> ATTRIBUTE_RENAMES = Map.of(
            "schema", "schema_name",
            "table", "table_name"
    );

    private static final List<String> COLUMN_SCALARS = List.of("precision", "scale", "max_length", "default");

    private final ObjectMapper objectMapper;
    private final NodeNameNormalizer childMapNormalizer;
    private final NodeNameNormalizer catalogNormalizer;

    private ManifestReader(Builder builder) {
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.childMapNormalizer = builder.childMapNormalizer;
        this.catalogNormalizer = builder.catalogNormalizer;
    }

    /**
     * Reads every source, in the given order.
     *
     * @throws ManifestException if fewer than two sources are given, a source
     *                           tag repeats, or any document is invalid
     */
    public List<SourceLineage> readAll(List<ManifestSource> sources) {
        if (sources == null || sources.size() < 2) {
            throw new ManifestException("At least two source documents are required, got " +
                    (sources == null ? 0 : sources.size()));
        }
        Set<String> seenTags = new HashSet<>();
        List<SourceLineage> result = new ArrayList<>(sources.size());
        for (ManifestSource source : sources) {
            if (!seenTags.add(source.sourceTag())) {
                throw new ManifestException("Duplicate source tag: " + source.sourceTag());
            }
            result.add(read(source));
        }
        return result;
    }

    /**
     * Reads one source document from disk.
     */
    public SourceLineage read(ManifestSource source) {
        Path path = source.path();
        if (!Files.isRegularFile(path)) {
            throw new ManifestException("File not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SourceLineage lineage = read(source.sourceTag(), reader);
            log.info("manifest.loaded source={} file={} nodes={}",
                    source.sourceTag(), path.getFileName(), lineage.nodeCount());
            return lineage;
        } catch (IOException e) {
            throw new ManifestException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads one source document from a reader. The reader is not closed.
     */
    public SourceLineage read(String sourceTag, Reader reader) {
        JsonNode document;
        try {
            document = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Malformed JSON in document for source '" + sourceTag + "': " +
                    e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestException("Cannot read document for source '" + sourceTag + "'", e);
        }

        ManifestFormat format = ManifestFormat.detect(document);
        if (format == null) {
            throw new ManifestException("Document for source '" + sourceTag +
                    "' contains none of lineage_map, child_map or lineage");
        }
        log.debug("Source '{}' uses format {}", sourceTag, format);

        JsonNode root = document.get(format.rootField());
        if (!root.isObject()) {
            throw new ManifestException("'" + format.rootField() + "' of source '" + sourceTag +
                    "' must be an object");
        }

        try {
            return switch (format) {
                case LINEAGE_MAP -> SourceLineage.of(sourceTag, readAdjacency(sourceTag, root, NodeNameNormalizer.IDENTITY));
                case CHILD_MAP -> SourceLineage.of(sourceTag, readAdjacency(sourceTag, root, childMapNormalizer));
                case CATALOG_LINEAGE -> readCatalogLineage(sourceTag, document, root);
            };
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid content in source '" + sourceTag + "': " + e.getMessage(), e);
        }
    }

    // ========== Adjacency formats ==========

    private Map<String, List<String>> readAdjacency(String sourceTag, JsonNode root,
                                                    NodeNameNormalizer normalizer) {
        Map<String, LinkedHashSet<String>> adjacency = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String node = normalizeId(entry.getKey(), normalizer);
            LinkedHashSet<String> children = adjacency.computeIfAbsent(node, k -> new LinkedHashSet<>());
            for (String rawChild : readStringArray(sourceTag, entry.getKey(), entry.getValue())) {
                children.add(normalizeId(rawChild, normalizer));
            }
        }
        return toLists(adjacency);
    }

    // ========== Catalog lineage format ==========

    private SourceLineage readCatalogLineage(String sourceTag, JsonNode document, JsonNode root) {
        Map<String, LinkedHashSet<String>> adjacency = new LinkedHashMap<>();
        Map<String, Map<String, Object>> attributes = new LinkedHashMap<>();
        Map<ColumnKey, Map<String, Object>> columns = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String rawDataset = entry.getKey();
            String dataset = normalizeId(rawDataset, catalogNormalizer);
            JsonNode info = entry.getValue();
            if (!info.isObject()) {
                throw new ManifestException("Entry '" + rawDataset + "' of source '" + sourceTag +
                        "' must be an object");
            }

            LinkedHashSet<String> children = adjacency.computeIfAbsent(dataset, k -> new LinkedHashSet<>());
            JsonNode downstream = info.get("downstream");
            if (downstream != null && !downstream.isNull()) {
                for (String rawChild : readStringArray(sourceTag, rawDataset, downstream)) {
                    children.add(normalizeId(rawChild, catalogNormalizer));
                }
            }

            Map<String, Object> datasetAttributes = attributes.computeIfAbsent(dataset, k -> new LinkedHashMap<>());
            datasetAttributes.put("dataset_type", datasetType(rawDataset));
            JsonNode schema = info.get("schema");
            if (schema != null && schema.isObject()) {
                extractSchemaAttributes(sourceTag, schema, datasetAttributes);
                extractColumns(sourceTag, dataset, schema.get("fields"), columns);
            }
        }

        List<ColumnMapping> mappings = readColumnLineage(sourceTag, document.get("column_lineage"));
        if (!columns.isEmpty() || !mappings.isEmpty()) {
            log.debug("Source '{}' declares {} columns and {} column mappings",
                    sourceTag, columns.size(), mappings.size());
        }
        return SourceLineage.of(sourceTag, toLists(adjacency), attributes, columns, mappings);
    }

    private void extractSchemaAttributes(String sourceTag, JsonNode schema, Map<String, Object> target) {
        Iterator<Map.Entry<String, JsonNode>> fields = schema.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if ("fields".equals(key) && value.isArray()) {
                target.put("column_count", value.size());
            } else if ("statistics".equals(key) && value.isObject()) {
                value.fields().forEachRemaining(stat -> putScalar(sourceTag, target, stat.getKey(), stat.getValue()));
            } else {
                putScalar(sourceTag, target, ATTRIBUTE_RENAMES.getOrDefault(key, key), value);
            }
        }
    }

    private void putScalar(String sourceTag, Map<String, Object> target, String key, JsonNode value) {
        Object scalar = toScalar(value);
        if (scalar == null) {
            return;
        }
        if (scalar instanceof String s) {
            if (s.isEmpty()) {
                return;
            }
            scalar = truncate(sourceTag, key, s);
        }
        target.put(sanitizeAttributeKey(key), scalar);
    }

    static String truncate(String sourceTag, String key, String value) {
        if (value.length() <= QuerySanitizer.MAX_ATTRIBUTE_LENGTH) {
            return value;
        }
        log.warn("manifest.attributeTruncated source={} attribute={} length={} max={}",
                sourceTag, key, value.length(), QuerySanitizer.MAX_ATTRIBUTE_LENGTH);
        return value.substring(0, QuerySanitizer.MAX_ATTRIBUTE_LENGTH);
    }

    // ========== Columns ==========

    private void extractColumns(String sourceTag, String dataset, JsonNode fields,
                                Map<ColumnKey, Map<String, Object>> columns) {
        if (fields == null || !fields.isArray()) {
            return;
        }
        int index = 0;
        for (JsonNode field : fields) {
            JsonNode name = field.get("name");
            if (!field.isObject() || name == null || !name.isTextual() || name.textValue().isBlank()) {
                throw new ManifestException("Field " + index + " of '" + dataset + "' in source '" + sourceTag +
                        "' must be an object with a name");
            }
            Map<String, Object> attrs = new LinkedHashMap<>();
            JsonNode type = field.get("type");
            attrs.put("data_type", DataTypeNormalizer.normalize(type != null && type.isTextual() ? type.textValue() : null));
            JsonNode nullable = field.get("nullable");
            attrs.put("nullable", nullable == null || !nullable.isBoolean() || nullable.booleanValue());
            for (String key : COLUMN_SCALARS) {
                putScalar(sourceTag, attrs, key, field.get(key));
            }
            columns.put(new ColumnKey(dataset, name.textValue()), attrs);
            index++;
        }
    }

    /**
     * Reads {@code {"dataset.column": [source, ...]}} where each source is
     * either {@code {"source_table": .., "source_column": .., "transformation": ..}}
     * or a qualified column name. A single object is accepted in place of the
     * list. Entries that name no usable column are skipped with a warning.
     */
    private List<ColumnMapping> readColumnLineage(String sourceTag, JsonNode columnLineage) {
        if (columnLineage == null || columnLineage.isNull()) {
            return List.of();
        }
        if (!columnLineage.isObject()) {
            throw new ManifestException("'column_lineage' of source '" + sourceTag + "' must be an object");
        }
        List<ColumnMapping> mappings = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = columnLineage.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            ColumnKey target = parseColumn(sourceTag, entry.getKey());
            if (target == null) {
                continue;
            }
            JsonNode sources = entry.getValue();
            if (sources.isObject() || sources.isTextual()) {
                addMapping(sourceTag, target, sources, mappings);
            } else if (sources.isArray()) {
                sources.forEach(source -> addMapping(sourceTag, target, source, mappings));
            } else if (!sources.isNull()) {
                log.warn("manifest.columnLineageSkipped source={} target={} reason=unsupported_value",
                        sourceTag, entry.getKey());
            }
        }
        return mappings;
    }

    private void addMapping(String sourceTag, ColumnKey target, JsonNode source, List<ColumnMapping> mappings) {
        if (source.isTextual()) {
            ColumnKey from = parseColumn(sourceTag, source.textValue());
            if (from != null) {
                mappings.add(new ColumnMapping(from, target, null));
            }
            return;
        }
        String table = source.path("source_table").asText("");
        String column = source.path("source_column").asText("");
        if (!source.isObject() || table.isBlank() || column.isBlank()) {
            log.warn("manifest.columnLineageSkipped source={} target={} reason=missing_source_column",
                    sourceTag, target);
            return;
        }
        JsonNode transformation = source.get("transformation");
        mappings.add(new ColumnMapping(
                new ColumnKey(normalizeId(table, catalogNormalizer), column),
                target,
                transformation != null && transformation.isTextual()
                        ? truncate(sourceTag, "transformation", transformation.textValue()) : null));
    }

    private ColumnKey parseColumn(String sourceTag, String qualifiedName) {
        try {
            ColumnKey raw = ColumnKey.parse(qualifiedName);
            return new ColumnKey(normalizeId(raw.dataset(), catalogNormalizer), raw.column());
        } catch (IllegalArgumentException e) {
            log.warn("manifest.columnLineageSkipped source={} column={} reason={}",
                    sourceTag, qualifiedName, e.getMessage());
            return null;
        }
    }

    private static Object toScalar(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return value.asText();
    }

    static String datasetType(String dataset) {
        if (dataset.startsWith("s3://")) {
            return "s3";
        }
        if (dataset.contains(".")) {
            return "table";
        }
        return "unknown";
    }

    static String sanitizeAttributeKey(String key) {
        String cleaned = key.replaceAll("[^A-Za-z0-9_]", "_");
        return cleaned.isEmpty() ? "_" : cleaned;
    }

    // ========== Helpers ==========

    private List<String> readStringArray(String sourceTag, String owner, JsonNode value) {
        if (!value.isArray()) {
            throw new ManifestException("Children of '" + owner + "' in source '" + sourceTag +
                    "' must be an array");
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new ManifestException("Child of '" + owner + "' in source '" + sourceTag +
                        "' must be a string, got " + item.getNodeType());
            }
            items.add(item.textValue());
        }
        return items;
    }

    private static String normalizeId(String raw, NodeNameNormalizer normalizer) {
        String id = normalizer.normalize(raw);
        QuerySanitizer.validateNodeId(id);
        return id;
    }

    private static Map<String, List<String>> toLists(Map<String, LinkedHashSet<String>> adjacency) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        adjacency.forEach((node, children) -> result.put(node, new ArrayList<>(children)));
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ObjectMapper objectMapper;
        private NodeNameNormalizer childMapNormalizer = NodeNameNormalizer.LAST_SEGMENT;
        private NodeNameNormalizer catalogNormalizer = NodeNameNormalizer.IDENTITY;

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Normalizer applied to identifiers of raw dbt child maps.
         */
        public Builder childMapNormalizer(NodeNameNormalizer normalizer) {
            if (normalizer == null) throw new IllegalArgumentException("normalizer is required");
            this.childMapNormalizer = normalizer;
            return this;
        }

        /**
         * Normalizer applied to dataset identifiers of raw catalog exports.
         */
        public Builder catalogNormalizer(NodeNameNormalizer normalizer) {
            if (normalizer == null) throw new IllegalArgumentException("normalizer is required");
            this.catalogNormalizer = normalizer;
            return this;
        }

        public ManifestReader build() {
            return new ManifestReader(this);
        }
    }
}
