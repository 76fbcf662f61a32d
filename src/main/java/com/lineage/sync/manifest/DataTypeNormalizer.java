package com.lineage.sync.manifest;

import java.util.Locale;
import java.util.Map;

/**
 * Maps catalog-specific column type names onto one vocabulary, so that the
 * same column reported by two catalogs carries the same {@code data_type}.
 * Unknown names are lower-cased and otherwise kept.
 */
public final class DataTypeNormalizer {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> SYNONYMS = Map.of(
            "string", "varchar",
            "character varying", "varchar",
            "long", "bigint",
            "integer", "int",
            "double", "double precision",
            "timestamp without time zone", "timestamp"
    );

    private DataTypeNormalizer() {
    }

    public static String normalize(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return UNKNOWN;
        }
        String lower = dataType.trim().toLowerCase(Locale.ROOT);
        return SYNONYMS.getOrDefault(lower, lower);
    }
}
