package com.lineage.sync.manifest;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Layouts of source documents understood by {@link ManifestReader}.
 */
public enum ManifestFormat {

    /** Already merged: {@code {"lineage_map": {node: [children]}}}. */
    LINEAGE_MAP("lineage_map"),

    /** Raw dbt manifest: {@code {"child_map": {uniqueId: [uniqueIds]}}}. */
    CHILD_MAP("child_map"),

    /** Raw catalog export: {@code {"lineage": {dataset: {"downstream": [...], "schema": {...}}}}}. */
    CATALOG_LINEAGE("lineage");

    private final String rootField;

    ManifestFormat(String rootField) {
        this.rootField = rootField;
    }

    public String rootField() {
        return rootField;
    }

    /**
     * Detects the format of a parsed document. Formats are checked in
     * declaration order, so a pre-merged map wins over raw content.
     *
     * @return the detected format, or null if none matches
     */
    public static ManifestFormat detect(JsonNode document) {
        if (document == null || !document.isObject()) {
            return null;
        }
        for (ManifestFormat format : values()) {
            if (document.has(format.rootField)) {
                return format;
            }
        }
        return null;
    }
}
