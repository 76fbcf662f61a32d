package com.lineage.sync.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identifies a column by its dataset and name.
 *
 * @param dataset node id of the owning dataset
 * @param column  column name within the dataset
 */
public record ColumnKey(String dataset, String column) {

    public ColumnKey {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("Column dataset must not be null or blank");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Column name must not be null or blank");
        }
    }

    /**
     * Splits {@code dataset.column} at the last dot.
     *
     * @throws IllegalArgumentException if there is no dot or either part is blank
     */
    public static ColumnKey parse(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName is required");
        int dot = qualifiedName.lastIndexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Not a qualified column name: '" + qualifiedName + "'");
        }
        return new ColumnKey(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
    }

    public String qualifiedName() {
        return dataset + "." + column;
    }

    /**
     * Stable store key of the column: hex SHA-256 of {@code dataset.column}.
     */
    public String columnId() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(qualifiedName().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
