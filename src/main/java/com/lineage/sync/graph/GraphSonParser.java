package com.lineage.sync.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads values out of GraphSON responses of the Gremlin HTTP endpoint.
 *
 * <p>{@code result.data} may be a plain JSON array or a typed
 * {@code {"@type": "g:List", "@value": [...]}} wrapper; scalar values may be
 * plain or typed ({@code g:Int64}, {@code g:Int32}); maps may be plain
 * objects or typed {@code g:Map} wrappers holding alternating keys and values.</p>
 */
public class GraphSonParser {

    private final ObjectMapper objectMapper;

    public GraphSonParser() {
        this(new ObjectMapper());
    }

    public GraphSonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * First numeric value of {@code result.data}, or empty if the body has none.
     */
    public OptionalLong parseCount(String body) {
        List<JsonNode> data = resultData(body);
        if (data.isEmpty()) {
            return OptionalLong.empty();
        }
        JsonNode value = unwrap(data.get(0));
        if (value == null || !value.isNumber()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value.asLong());
    }

    /**
     * Parses {@code project('name','source')} results.
     */
    public List<VertexSample> parseSamples(String body) {
        List<VertexSample> samples = new ArrayList<>();
        for (JsonNode row : resultData(body)) {
            mapValue(row, "name").ifPresent(name ->
                    samples.add(new VertexSample(name, mapValue(row, "source").orElse(null))));
        }
        return samples;
    }

    private List<JsonNode> resultData(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode data = unwrap(root.path("result").path("data"));
        List<JsonNode> items = new ArrayList<>();
        if (data != null && data.isArray()) {
            data.forEach(items::add);
        }
        return items;
    }

    private Optional<String> mapValue(JsonNode row, String key) {
        JsonNode map = row;
        if (row.has("@type") && "g:Map".equals(row.path("@type").asText())) {
            JsonNode entries = row.path("@value");
            for (int i = 0; i + 1 < entries.size(); i += 2) {
                JsonNode k = unwrap(entries.get(i));
                if (k != null && key.equals(k.asText())) {
                    return textOf(entries.get(i + 1));
                }
            }
            return Optional.empty();
        }
        return textOf(map.get(key));
    }

    private Optional<String> textOf(JsonNode node) {
        JsonNode value = unwrap(node);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        // project().by() over a multi-property returns a list
        if (value.isArray()) {
            return value.size() > 0 ? textOf(value.get(0)) : Optional.empty();
        }
        return Optional.of(value.asText());
    }

    private static JsonNode unwrap(JsonNode node) {
        JsonNode current = node;
        while (current != null && current.isObject() && current.has("@type") && current.has("@value")) {
            current = current.get("@value");
        }
        return current;
    }
}
