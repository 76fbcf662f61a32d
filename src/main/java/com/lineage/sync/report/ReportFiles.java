package com.lineage.sync.report;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locations of the reports written for a run. A report that could not be
 * written is empty.
 */
public record ReportFiles(Optional<Path> json, Optional<Path> csv) {

    public static ReportFiles none() {
        return new ReportFiles(Optional.empty(), Optional.empty());
    }
}
