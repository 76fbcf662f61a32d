package com.lineage.sync.graph;

/**
 * Validation and escaping rules for values that end up inside Gremlin queries.
 *
 * <p>Node identifiers come from external catalogs and may contain any
 * character. Every string literal sent to the store passes through
 * {@link #escapeLiteral(String)}; labels and property keys are never escaped
 * and must instead match {@link #validateName(String, String)}.</p>
 */
public final class QuerySanitizer {

    /** Longest string value kept as a vertex attribute; longer values are truncated at read time. */
    public static final int MAX_ATTRIBUTE_LENGTH = 4000;

    private QuerySanitizer() {
        // utility class
    }

    /**
     * Validates a node identifier. Any character is allowed, since catalog
     * identifiers are escaped on the way into a query; only null and blank
     * ids are rejected.
     *
     * @throws IllegalArgumentException if the id is null or blank
     */
    public static void validateNodeId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be null or blank");
        }
    }

    /**
     * Validates a vertex label, edge label or property key.
     * Only alphanumeric characters and underscores are allowed.
     *
     * @param name the name to validate
     * @param kind what the name is, used in the error message
     * @throws IllegalArgumentException if the name is invalid
     */
    public static void validateName(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " must not be null or blank");
        }
        if (!name.matches("^[A-Za-z0-9_]+$")) {
            throw new IllegalArgumentException(
                    kind + " must contain only alphanumeric characters and underscores, " +
                            "got: '" + name + "'");
        }
    }

    /**
     * Escapes a value for use inside a single-quoted Gremlin string literal.
     * The surrounding quotes are not added.
     *
     * <p>Backslash is escaped first, then single and double quotes, then
     * newline, carriage return and tab. Every other control character
     * (0x00-0x1F, 0x7F) becomes a backslash-u escape with four hex digits,
     * so no input can end the literal early.</p>
     *
     * @throws IllegalArgumentException if the value is null
     */
    public static String escapeLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal must not be null");
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (isControlCharacter(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Renders a value as a Gremlin literal: strings quoted and escaped,
     * numbers and booleans as-is.
     *
     * @throws IllegalArgumentException for null or unsupported value types
     */
    public static String toLiteral(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal must not be null");
        }
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new IllegalArgumentException("Non-finite numbers are not supported: " + d);
            }
            return value.toString();
        }
        if (value instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) {
                throw new IllegalArgumentException("Non-finite numbers are not supported: " + f);
            }
            return value.toString();
        }
        if (value instanceof CharSequence) {
            return "'" + escapeLiteral(value.toString()) + "'";
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    /**
     * Whether {@link #toLiteral(Object)} accepts the value.
     */
    public static boolean isRenderable(Object value) {
        try {
            toLiteral(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isControlCharacter(char c) {
        return c < 0x20 || c == 0x7F;
    }
}
