package com.fleetmind.core.persistence;

/**
 * Raised when the durable run store cannot complete a read or write.
 */
public class RunStoreException extends RuntimeException {

    public RunStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
