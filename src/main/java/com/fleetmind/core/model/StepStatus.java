package com.fleetmind.core.model;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase();
    }
}
