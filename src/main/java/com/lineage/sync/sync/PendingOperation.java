package com.lineage.sync.sync;

import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;

import java.util.List;
import java.util.Objects;

/**
 * A unit of work that failed during the main pass and is replayed once by the
 * recovery pass. Holds only ids and provenance labels.
 */
public sealed interface PendingOperation permits PendingOperation.NodeRetry, PendingOperation.EdgeRetry,
        PendingOperation.ColumnRetry, PendingOperation.ColumnEdgeRetry {

    String describe();

    /**
     * A node whose vertex could not be written; its outgoing edges were skipped.
     */
    record NodeRetry(String id, List<String> children) implements PendingOperation {
        public NodeRetry {
            Objects.requireNonNull(id, "id is required");
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public String describe() {
            return "node " + id + " (" + children.size() + " children)";
        }
    }

    /**
     * An edge that could not be written although its parent vertex was.
     */
    record EdgeRetry(String parent, String child, String parentProvenance, String childProvenance)
            implements PendingOperation {
        public EdgeRetry {
            Objects.requireNonNull(parent, "parent is required");
            Objects.requireNonNull(child, "child is required");
        }

        @Override
        public String describe() {
            return "edge " + parent + " -> " + child + " (" + parentProvenance + " -> " + childProvenance + ")";
        }
    }

    /**
     * A column whose vertex or membership edge could not be written; its
     * outgoing column lineage edges were skipped.
     */
    record ColumnRetry(ColumnKey column) implements PendingOperation {
        public ColumnRetry {
            Objects.requireNonNull(column, "column is required");
        }

        @Override
        public String describe() {
            return "column " + column;
        }
    }

    /**
     * A column lineage edge that could not be written although its source
     * column was.
     */
    record ColumnEdgeRetry(ColumnMapping mapping) implements PendingOperation {
        public ColumnEdgeRetry {
            Objects.requireNonNull(mapping, "mapping is required");
        }

        @Override
        public String describe() {
            return "column lineage " + mapping.source() + " -> " + mapping.target() +
                    " (" + mapping.transformation() + ")";
        }
    }
}
