package com.fleetmind.core.model;

/**
 * The three steps of a pipeline, in execution order.
 */
public enum StepRole {
    PLANNING(1),
    BUILDING(2),
    VERIFYING(3);

    private final int stepNumber;

    StepRole(int stepNumber) {
        this.stepNumber = stepNumber;
    }

    public int stepNumber() {
        return stepNumber;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
