package com.lineage.sync.graph;

/**
 * Key and provenance label of a stored vertex.
 *
 * @param name       value of the key property
 * @param sourceType provenance label
 */
public record VertexSample(String name, String sourceType) {
}
