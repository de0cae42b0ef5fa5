package com.fleetmind.core.engine;

import com.fleetmind.core.model.StepRole;

/**
 * A pipeline step could not produce an artifact. The orchestrator turns it into a FAILED pipeline.
 */
public class StepFailedException extends RuntimeException {

    private final StepRole role;

    public StepFailedException(StepRole role, String message) {
        super(message);
        this.role = role;
    }

    public StepFailedException(StepRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public StepRole getRole() {
        return role;
    }
}
