package com.fleetmind.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A notification raised by the supervisor or the orchestrator for external observers.
 *
 * @param eventType  one of the names in {@link EventTypes}
 * @param pipelineId the pipeline this event belongs to (nullable for standalone workers)
 * @param workerId   the worker this event relates to (nullable for pipeline-level events)
 * @param payload    event data
 * @param timestamp  when the event occurred
 */
public record FleetEvent(
    String eventType,
    String pipelineId,
    String workerId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static FleetEvent forWorker(String eventType, String pipelineId, String workerId,
                                       Map<String, Object> payload) {
        return new FleetEvent(eventType, pipelineId, workerId, payload, Instant.now());
    }

    public static FleetEvent forPipeline(String eventType, String pipelineId, Map<String, Object> payload) {
        return new FleetEvent(eventType, pipelineId, null, payload, Instant.now());
    }
}
