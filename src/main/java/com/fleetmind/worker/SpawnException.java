package com.fleetmind.worker;

/**
 * Thrown when a worker process cannot be located or started.
 */
public class SpawnException extends Exception {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
