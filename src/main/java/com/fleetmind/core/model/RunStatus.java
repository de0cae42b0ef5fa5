package com.fleetmind.core.model;

/**
 * Lifecycle status of a durable run record.
 */
public enum RunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    STOPPED("stopped"),
    CRASHED("crashed"),
    WAITING_INPUT("waiting_input");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a stored status name. Unrecognized names are read as {@link #CRASHED}
     * so that a damaged row is still offered for resumption.
     */
    public static RunStatus fromWireName(String name) {
        for (RunStatus status : values()) {
            if (status.wireName.equals(name)) {
                return status;
            }
        }
        return CRASHED;
    }

    public boolean isLive() {
        return this == RUNNING || this == WAITING_INPUT;
    }
}
