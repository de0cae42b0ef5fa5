package com.fleetmind.core.model;

import java.time.Instant;

/**
 * Filters for searching run records. Null fields do not filter.
 */
public record RunQuery(
    RunStatus status,
    String workingDir,
    WorkerSource source,
    Instant startedAfter,
    Instant startedBefore,
    Integer limit,
    Integer offset
) {

    public static RunQuery all() {
        return new RunQuery(null, null, null, null, null, null, null);
    }

    public static RunQuery byStatus(RunStatus status) {
        return new RunQuery(status, null, null, null, null, null, null);
    }

    public RunQuery withLimit(int limit) {
        return new RunQuery(status, workingDir, source, startedAfter, startedBefore, limit, offset);
    }

    public boolean matches(RunRecord run) {
        if (status != null && run.getStatus() != status) return false;
        if (workingDir != null && !workingDir.equals(run.getWorkingDir())) return false;
        if (source != null && run.getSource() != source) return false;
        if (startedAfter != null && (run.getStartedAt() == null || run.getStartedAt().isBefore(startedAfter))) return false;
        return startedBefore == null || (run.getStartedAt() != null && !run.getStartedAt().isAfter(startedBefore));
    }
}
