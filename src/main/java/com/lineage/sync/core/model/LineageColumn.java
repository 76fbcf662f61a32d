package com.lineage.sync.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A column of the merged graph with the sources that reported it and its
 * scalar metadata ({@code data_type}, {@code nullable}, {@code precision} and
 * so on).
 */
public record LineageColumn(ColumnKey key, Provenance provenance, Map<String, Object> attributes) {

    public LineageColumn {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(provenance, "provenance is required");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }
}
