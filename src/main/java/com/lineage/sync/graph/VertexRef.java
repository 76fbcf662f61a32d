package com.lineage.sync.graph;

/**
 * Identifies a vertex by label and the value of its uniqueness property.
 */
public record VertexRef(String label, String keyProperty, String key) {

    public VertexRef {
        QuerySanitizer.validateName(label, "Vertex label");
        QuerySanitizer.validateName(keyProperty, "Key property");
        QuerySanitizer.validateNodeId(key);
    }

    public static VertexRef node(String nodeId) {
        return new VertexRef(LineageSchema.VERTEX_LABEL, LineageSchema.KEY_PROPERTY, nodeId);
    }

    public static VertexRef column(String columnId) {
        return new VertexRef(LineageSchema.COLUMN_LABEL, LineageSchema.COLUMN_KEY_PROPERTY, columnId);
    }
}
