package com.lineage.sync.graph;

import java.util.Set;

/**
 * Labels and property keys of the lineage graph as stored in the remote store.
 */
public final class LineageSchema {

    public static final String VERTEX_LABEL = "lineage_node";
    public static final String EDGE_LABEL = "data_flow";

    /** Uniqueness key of a vertex. */
    public static final String KEY_PROPERTY = "node_name";
    /** Provenance label of a vertex. */
    public static final String SOURCE_TYPE_PROPERTY = "source_type";
    public static final String CREATED_TIMESTAMP_PROPERTY = "created_timestamp";

    public static final String EDGE_TYPE_PROPERTY = "edge_type";
    public static final String PARENT_SOURCE_PROPERTY = "parent_source";
    public static final String CHILD_SOURCE_PROPERTY = "child_source";

    /** Properties owned by the writer; node attributes never override them. */
    public static final Set<String> RESERVED_VERTEX_PROPERTIES =
            Set.of(KEY_PROPERTY, SOURCE_TYPE_PROPERTY, CREATED_TIMESTAMP_PROPERTY);

    // ========== Column lineage ==========

    public static final String COLUMN_LABEL = "column";
    /** Uniqueness key of a column vertex: SHA-256 of {@code dataset.column}. */
    public static final String COLUMN_KEY_PROPERTY = "column_id";
    public static final String COLUMN_NAME_PROPERTY = "column_name";
    public static final String DATASET_PROPERTY = "dataset";

    /** Dataset vertex to column vertex. */
    public static final String HAS_COLUMN_LABEL = "has_column";
    /** Source column vertex to target column vertex. */
    public static final String COLUMN_LINEAGE_LABEL = "column_lineage";
    public static final String TRANSFORMATION_PROPERTY = "transformation";

    public static final Set<String> RESERVED_COLUMN_PROPERTIES = Set.of(COLUMN_KEY_PROPERTY, COLUMN_NAME_PROPERTY,
            DATASET_PROPERTY, SOURCE_TYPE_PROPERTY, CREATED_TIMESTAMP_PROPERTY);

    private LineageSchema() {
    }
}
