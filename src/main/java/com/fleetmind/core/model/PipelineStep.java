package com.fleetmind.core.model;

import java.time.Instant;

/**
 * One step of a pipeline and the worker that ran it.
 */
public class PipelineStep {

    private final StepRole role;
    private StepStatus status = StepStatus.PENDING;
    private String workerId;
    private StepOutput output;
    private Instant startedAt;
    private Instant completedAt;

    public PipelineStep(StepRole role) {
        this.role = role;
    }

    /** Returns the step to PENDING, forgetting its worker and output. */
    public void reset() {
        status = StepStatus.PENDING;
        workerId = null;
        output = null;
        startedAt = null;
        completedAt = null;
    }

    public PipelineStep copy() {
        var c = new PipelineStep(role);
        c.status = status;
        c.workerId = workerId;
        c.output = output;
        c.startedAt = startedAt;
        c.completedAt = completedAt;
        return c;
    }

    public StepRole getRole() { return role; }
    public int getStepNumber() { return role.stepNumber(); }
    public StepStatus getStatus() { return status; }
    public void setStatus(StepStatus status) { this.status = status; }
    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public StepOutput getOutput() { return output; }
    public void setOutput(StepOutput output) { this.output = output; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
