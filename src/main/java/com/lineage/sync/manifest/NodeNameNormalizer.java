package com.lineage.sync.manifest;

/**
 * Maps a raw catalog identifier to the node id used in the merged graph.
 */
@FunctionalInterface
public interface NodeNameNormalizer {

    String normalize(String rawName);

    /**
     * Keeps the final dot-separated segment, e.g. {@code model.shop.orders} becomes {@code orders}.
     */
    NodeNameNormalizer LAST_SEGMENT = rawName -> {
        int idx = rawName.lastIndexOf('.');
        return idx >= 0 ? rawName.substring(idx + 1) : rawName;
    };

    /**
     * Keeps the identifier unchanged.
     */
    NodeNameNormalizer IDENTITY = rawName -> rawName;
}
