package com.lineage.sync.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable set of source tags that reported a lineage node.
 *
 * Two provenances are equal when they hold the same tags, regardless of the
 * order in which the tags were added. The {@link #label()} form (sorted,
 * comma-joined) is what gets written to the graph store and the reports.
 */
public final class Provenance {

    /** Tag used only when no source claims a node. */
    public static final String UNKNOWN_TAG = "unknown";

    private static final Provenance UNKNOWN = new Provenance(new TreeSet<>(Collections.singleton(UNKNOWN_TAG)));

    private final SortedSet<String> tags;

    private Provenance(SortedSet<String> tags) {
        this.tags = Collections.unmodifiableSortedSet(tags);
    }

    /**
     * Creates a provenance from one or more source tags.
     *
     * @throws IllegalArgumentException if no tag is given or a tag is blank
     */
    public static Provenance of(String... tags) {
        return of(Arrays.asList(tags));
    }

    /**
     * Creates a provenance from a collection of source tags.
     * An empty collection yields the {@link #unknown()} provenance.
     */
    public static Provenance of(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags is required");
        if (tags.isEmpty()) {
            return UNKNOWN;
        }
        TreeSet<String> copy = new TreeSet<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("Provenance tag must not be null or blank");
            }
            copy.add(tag);
        }
        return new Provenance(copy);
    }

    public static Provenance unknown() {
        return UNKNOWN;
    }

    /**
     * Parses a label produced by {@link #label()}.
     */
    public static Provenance fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        return of(Arrays.stream(label.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }

    public SortedSet<String> tags() {
        return tags;
    }

    public int size() {
        return tags.size();
    }

    public boolean contains(String tag) {
        return tags.contains(tag);
    }

    public boolean isUnknown() {
        return tags.size() == 1 && tags.contains(UNKNOWN_TAG);
    }

    /**
     * True when more than one source reported the node.
     */
    public boolean isShared() {
        return tags.size() > 1;
    }

    /**
     * Returns the sorted, comma-joined tag list, e.g. {@code athena,redshift}.
     */
    public String label() {
        return String.join(",", tags);
    }

    public Provenance union(Provenance other) {
        TreeSet<String> merged = new TreeSet<>(tags);
        merged.addAll(other.tags);
        if (merged.size() > 1) {
            merged.remove(UNKNOWN_TAG);
        }
        return new Provenance(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provenance that = (Provenance) o;
        return tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return "Provenance{" + label() + '}';
    }
}
