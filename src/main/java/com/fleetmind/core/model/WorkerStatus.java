package com.fleetmind.core.model;

/**
 * Lifecycle status of a supervised worker process.
 */
public enum WorkerStatus {
    IDLE("idle"),
    PROCESSING("processing"),
    WAITING_FOR_INPUT("waiting_for_input"),
    STOPPED("stopped"),
    ERROR("error");

    private final String wireName;

    WorkerStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True once the worker has nothing left to do until it receives new input
     * or is replaced.
     */
    public boolean isSettled() {
        return this == WAITING_FOR_INPUT || this == STOPPED || this == ERROR;
    }
}
