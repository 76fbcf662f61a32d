package com.lineage.sync.api;

import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.report.ReportFiles;
import com.lineage.sync.sync.PendingOperation;
import com.lineage.sync.sync.SyncStatistics;
import com.lineage.sync.verify.VerificationReport;

import java.util.List;
import java.util.Optional;

/**
 * Everything a synchronization run produced.
 *
 * @param runId        identifier of the run, also present in the log MDC
 * @param graph        the merged graph that was written
 * @param statistics   aggregate figures
 * @param verification counts read back from the store, empty if verification was disabled or skipped
 * @param reports      report files written, if any
 * @param unresolved   operations still failed after the recovery pass
 */
public record SyncReport(
        String runId,
        MergedGraph graph,
        SyncStatistics statistics,
        Optional<VerificationReport> verification,
        ReportFiles reports,
        List<PendingOperation> unresolved
) {
    public SyncReport {
        verification = verification != null ? verification : Optional.empty();
        reports = reports != null ? reports : ReportFiles.none();
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
    }

    public boolean isFullySynchronized() {
        return unresolved.isEmpty() && !statistics.cancelled();
    }
}
