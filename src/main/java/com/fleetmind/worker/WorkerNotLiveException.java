package com.fleetmind.worker;

/**
 * Thrown when input is sent to a worker that is unknown or has already ended.
 */
public class WorkerNotLiveException extends RuntimeException {

    private final String workerId;

    public WorkerNotLiveException(String workerId) {
        super("Worker " + workerId + " is not live");
        this.workerId = workerId;
    }

    public WorkerNotLiveException(String workerId, Throwable cause) {
        super("Worker " + workerId + " is not live", cause);
        this.workerId = workerId;
    }

    public String getWorkerId() {
        return workerId;
    }
}
