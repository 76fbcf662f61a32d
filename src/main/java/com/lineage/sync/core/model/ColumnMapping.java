package com.lineage.sync.core.model;

import java.util.Objects;

/**
 * Column-level data flow: {@code target} is derived from {@code source}.
 * Mappings are unique by (source, target).
 *
 * @param source         upstream column
 * @param target         downstream column
 * @param transformation how the value is derived, {@value #DIRECT} when not reported
 */
public record ColumnMapping(ColumnKey source, ColumnKey target, String transformation) {

    public static final String DIRECT = "direct";

    public ColumnMapping {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        transformation = transformation == null || transformation.isBlank() ? DIRECT : transformation;
    }

    /**
     * Identity key of the mapping, {@code source->target}.
     */
    public String key() {
        return source.qualifiedName() + "->" + target.qualifiedName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnMapping that)) return false;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }
}
