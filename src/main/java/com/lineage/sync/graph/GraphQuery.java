package com.lineage.sync.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Gremlin traversal with named placeholders and the values bound to them.
 *
 * <p>Placeholders use the {@code $name} syntax. Labels and property keys are
 * part of the template and are validated when the query is built; every
 * value is a binding and only becomes text in {@link #render()}, where it is
 * inlined as an escaped literal through {@link QuerySanitizer#toLiteral(Object)}.</p>
 *
 * <p>Property values of upserts are bound as {@code p_<key>} and count filters
 * as {@code f_<key>}, so a query can be inspected without parsing its text.</p>
 */
public final class GraphQuery {

    public static final String PROPERTY_PREFIX = "p_";
    public static final String FILTER_PREFIX = "f_";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    public enum Kind {
        UPSERT_VERTEX,
        UPSERT_EDGE,
        DROP_ALL,
        COUNT_VERTICES,
        COUNT_EDGES,
        SAMPLE_VERTICES
    }

    private final Kind kind;
    private final String label;
    private final String template;
    private final Map<String, Object> bindings;

    GraphQuery(Kind kind, String label, String template, Map<String, Object> bindings) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.label = label;
        this.template = Objects.requireNonNull(template, "template is required");
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Vertex or edge label the query targets, or null for label-less queries.
     */
    public String getLabel() {
        return label;
    }

    public String getTemplate() {
        return template;
    }

    public Map<String, Object> getBindings() {
        return bindings;
    }

    public Object binding(String name) {
        return bindings.get(name);
    }

    /**
     * Bindings with the given prefix, keyed by the remainder of their name.
     */
    public Map<String, Object> bindingsWithPrefix(String prefix) {
        Map<String, Object> result = new LinkedHashMap<>();
        bindings.forEach((name, value) -> {
            if (name.startsWith(prefix)) {
                result.put(name.substring(prefix.length()), value);
            }
        });
        return result;
    }

    /**
     * Produces the query text with every placeholder replaced by its literal.
     *
     * @throws IllegalStateException    if a placeholder has no binding
     * @throws IllegalArgumentException if a bound value cannot be escaped
     */
    public String render() {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 64);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!bindings.containsKey(name)) {
                throw new IllegalStateException("No binding for placeholder $" + name);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(QuerySanitizer.toLiteral(bindings.get(name))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "GraphQuery{kind=" + kind + ", label=" + label + ", bindings=" + bindings.size() + '}';
    }
}
