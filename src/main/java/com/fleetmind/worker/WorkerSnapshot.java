package com.fleetmind.worker;

import com.fleetmind.core.model.WorkerSource;
import com.fleetmind.core.model.WorkerStatistics;
import com.fleetmind.core.model.WorkerStatus;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Read-only view of a worker at one point in time.
 * {@code turnFailed} is set when the latest turn ended with a non-success result.
 */
public record WorkerSnapshot(
    String id,
    Path workingDir,
    WorkerStatus status,
    String sessionId,
    boolean processing,
    boolean pendingInput,
    boolean turnFailed,
    Instant lastActivity,
    String pipelineId,
    WorkerSource source,
    String lastText,
    String model,
    long pid,
    WorkerStatistics.Snapshot statistics
) {}
