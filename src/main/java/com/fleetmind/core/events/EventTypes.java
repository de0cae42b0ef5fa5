package com.fleetmind.core.events;

/**
 * Names of the notifications carried by {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String WORKER_OUTPUT = "worker.output";
    public static final String WORKER_STATUS = "worker.status";
    public static final String WORKER_STATS = "worker.stats";
    public static final String WORKER_INPUT_REQUIRED = "worker.input_required";

    public static final String PIPELINE_CREATED = "pipeline.created";
    public static final String PIPELINE_STATE_CHANGED = "pipeline.state_changed";
    public static final String PIPELINE_STEP_STATUS = "pipeline.step_status";
    public static final String PIPELINE_STEP_COMPLETED = "pipeline.step_completed";
    public static final String PIPELINE_DECISION = "pipeline.decision";
    public static final String PIPELINE_COMPLETED = "pipeline.completed";
}
