package com.fleetmind.worker;

import com.fleetmind.core.model.WorkerSource;

import java.nio.file.Path;

/**
 * Parameters for spawning a worker.
 *
 * @param workingDir directory the worker process runs in
 * @param model      model override (nullable; falls back to configuration)
 * @param source     who asked for the worker
 * @param pipelineId owning pipeline (nullable for standalone workers)
 */
public record SpawnRequest(
    Path workingDir,
    String model,
    WorkerSource source,
    String pipelineId
) {

    public static SpawnRequest standalone(Path workingDir, WorkerSource source) {
        return new SpawnRequest(workingDir, null, source, null);
    }

    public static SpawnRequest forPipeline(Path workingDir, String pipelineId) {
        return new SpawnRequest(workingDir, null, WorkerSource.PIPELINE, pipelineId);
    }
}
