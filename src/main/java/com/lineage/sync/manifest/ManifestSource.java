package com.lineage.sync.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A source document and the tag recorded as provenance for its nodes.
 *
 * @param sourceTag provenance tag, e.g. {@code athena}
 * @param path      location of the JSON document
 */
public record ManifestSource(String sourceTag, Path path) {

    private static final Pattern FILE_PATTERN =
            Pattern.compile("^([A-Za-z0-9_-]+?)_(manifest|lineage_map)\\.json$");

    public ManifestSource {
        if (sourceTag == null || sourceTag.isBlank()) {
            throw new IllegalArgumentException("sourceTag must not be null or blank");
        }
        Objects.requireNonNull(path, "path is required");
    }

    public static ManifestSource of(String sourceTag, Path path) {
        return new ManifestSource(sourceTag, path);
    }

    /**
     * Finds {@code <tag>_manifest.json} and {@code <tag>_lineage_map.json}
     * files directly inside a data directory, sorted by tag.
     *
     * @throws ManifestException if the directory cannot be listed, a tag
     *                           appears twice, or fewer than two sources exist
     */
    public static List<ManifestSource> discover(Path dataDirectory) {
        Objects.requireNonNull(dataDirectory, "dataDirectory is required");
        if (!Files.isDirectory(dataDirectory)) {
            throw new ManifestException("Data directory not found: " + dataDirectory);
        }

        List<ManifestSource> sources = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDirectory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                Matcher matcher = FILE_PATTERN.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    sources.add(new ManifestSource(matcher.group(1), file));
                }
            });
        } catch (IOException e) {
            throw new ManifestException("Cannot list data directory " + dataDirectory, e);
        }

        sources.sort(Comparator.comparing(ManifestSource::sourceTag));
        for (int i = 1; i < sources.size(); i++) {
            if (sources.get(i).sourceTag().equals(sources.get(i - 1).sourceTag())) {
                throw new ManifestException("Source '" + sources.get(i).sourceTag() +
                        "' has more than one document in " + dataDirectory);
            }
        }
        if (sources.size() < 2) {
            throw new ManifestException("At least two source documents are required in " + dataDirectory +
                    ", found " + sources.size());
        }
        return List.copyOf(sources);
    }
}
