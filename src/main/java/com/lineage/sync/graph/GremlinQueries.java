package com.lineage.sync.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the idempotent Gremlin traversals used to replicate the lineage graph.
 *
 * <p>Upserts are existence-check-then-create: a vertex is looked up by label
 * and its uniqueness property ({@link LineageSchema#KEY_PROPERTY} for lineage
 * nodes, {@link LineageSchema#COLUMN_KEY_PROPERTY} for columns) and added
 * only when absent; an edge is added only when no edge with the same label
 * already joins the same two vertices. Running the same upsert twice leaves the store unchanged.</p>
 */
public final class GremlinQueries {

    private GremlinQueries() {
    }

    /**
     * {@code g.V().has(label,'node_name',id).fold().coalesce(unfold(), addV(label).property(...))}
     */
    public static GraphQuery upsertVertex(String label, String key, Map<String, Object> properties) {
        return upsertVertex(new VertexRef(label, LineageSchema.KEY_PROPERTY, key), properties);
    }

    /**
     * {@code g.V().has(label,keyProperty,key).fold().coalesce(unfold(), addV(label).property(...))}
     */
    public static GraphQuery upsertVertex(VertexRef vertex, Map<String, Object> properties) {
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("key", vertex.key());

        StringBuilder q = new StringBuilder();
        q.append(lookup("g.V()", vertex, "key"))
                .append(".fold().coalesce(unfold(),addV('").append(vertex.label()).append("')")
                .append(".property('").append(vertex.keyProperty()).append("',$key)");
        appendProperties(q, bindings, properties);
        q.append(')');

        return new GraphQuery(GraphQuery.Kind.UPSERT_VERTEX, vertex.label(), q.toString(), bindings);
    }

    /**
     * Edge between two lineage node vertices.
     *
     * @see #upsertEdge(VertexRef, VertexRef, String, Map)
     */
    public static GraphQuery upsertEdge(String fromKey, String toKey, String label, Map<String, Object> properties) {
        return upsertEdge(VertexRef.node(fromKey), VertexRef.node(toKey), label, properties);
    }

    /**
     * {@code g.V().has(..,from).as('p').V().has(..,to).coalesce(inE(label).where(outV().as('p')), addE(label).from('p')...)}
     *
     * <p>Both endpoints must already exist; when either is missing the
     * traversal yields nothing and no edge is created.</p>
     */
    public static GraphQuery upsertEdge(VertexRef from, VertexRef to, String label, Map<String, Object> properties) {
        QuerySanitizer.validateName(label, "Edge label");

        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("from", from.key());
        bindings.put("to", to.key());

        StringBuilder q = new StringBuilder();
        q.append(lookup("g.V()", from, "from")).append(".as('p')")
                .append(lookup(".V()", to, "to"))
                .append(".coalesce(inE('").append(label).append("').where(outV().as('p')),")
                .append("addE('").append(label).append("').from('p')");
        appendProperties(q, bindings, properties);
        q.append(')');

        return new GraphQuery(GraphQuery.Kind.UPSERT_EDGE, label, q.toString(), bindings);
    }

    public static GraphQuery dropAll() {
        return new GraphQuery(GraphQuery.Kind.DROP_ALL, null, "g.V().drop()", Map.of());
    }

    public static GraphQuery countVertices() {
        return new GraphQuery(GraphQuery.Kind.COUNT_VERTICES, null, "g.V().count()", Map.of());
    }

    public static GraphQuery countVertices(String property, Object value) {
        return filteredCount(GraphQuery.Kind.COUNT_VERTICES, "g.V()", null, property, value);
    }

    public static GraphQuery countVerticesWithLabel(String label) {
        return labelledCount(GraphQuery.Kind.COUNT_VERTICES, "g.V()", label);
    }

    public static GraphQuery countVerticesWithLabel(String label, String property, Object value) {
        return filteredCount(GraphQuery.Kind.COUNT_VERTICES, "g.V()", label, property, value);
    }

    public static GraphQuery countEdges() {
        return new GraphQuery(GraphQuery.Kind.COUNT_EDGES, null, "g.E().count()", Map.of());
    }

    public static GraphQuery countEdges(String property, Object value) {
        return filteredCount(GraphQuery.Kind.COUNT_EDGES, "g.E()", null, property, value);
    }

    public static GraphQuery countEdgesWithLabel(String label) {
        return labelledCount(GraphQuery.Kind.COUNT_EDGES, "g.E()", label);
    }

    public static GraphQuery countEdgesWithLabel(String label, String property, Object value) {
        return filteredCount(GraphQuery.Kind.COUNT_EDGES, "g.E()", label, property, value);
    }

    /**
     * Projects up to {@code limit} vertices to their key and provenance label.
     */
    public static GraphQuery sampleVertices(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        String template = "g.V().hasLabel('" + LineageSchema.VERTEX_LABEL + "').limit($limit).project('name','source')" +
                ".by('" + LineageSchema.KEY_PROPERTY + "')" +
                ".by('" + LineageSchema.SOURCE_TYPE_PROPERTY + "')";
        return new GraphQuery(GraphQuery.Kind.SAMPLE_VERTICES, LineageSchema.VERTEX_LABEL, template,
                Map.of("limit", limit));
    }

    private static GraphQuery labelledCount(GraphQuery.Kind kind, String start, String label) {
        QuerySanitizer.validateName(label, "Label");
        return new GraphQuery(kind, label, start + ".hasLabel('" + label + "').count()", Map.of());
    }

    private static GraphQuery filteredCount(GraphQuery.Kind kind, String start, String label,
                                            String property, Object value) {
        QuerySanitizer.validateName(property, "Property key");
        String binding = GraphQuery.FILTER_PREFIX + property;
        StringBuilder template = new StringBuilder(start);
        if (label != null) {
            QuerySanitizer.validateName(label, "Label");
            template.append(".hasLabel('").append(label).append("')");
        }
        template.append(".has('").append(property).append("',$").append(binding).append(").count()");
        return new GraphQuery(kind, label, template.toString(), Map.of(binding, value));
    }

    private static String lookup(String start, VertexRef vertex, String binding) {
        return start + ".has('" + vertex.label() + "','" + vertex.keyProperty() + "',$" + binding + ")";
    }

    private static void appendProperties(StringBuilder q, Map<String, Object> bindings,
                                         Map<String, Object> properties) {
        if (properties == null) {
            return;
        }
        properties.forEach((key, value) -> {
            QuerySanitizer.validateName(key, "Property key");
            if (value == null) {
                return;
            }
            // fail at build time rather than at render time
            QuerySanitizer.toLiteral(value);
            String binding = GraphQuery.PROPERTY_PREFIX + key;
            bindings.put(binding, value);
            q.append(".property('").append(key).append("',$").append(binding).append(')');
        });
    }
}
