package com.fleetmind.worker;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * A running worker process as seen by the supervisor.
 */
public interface WorkerProcess {

    OutputStream stdin();

    InputStream stdout();

    InputStream stderr();

    boolean isAlive();

    /** OS process id, or -1 when unknown. */
    long pid();

    /**
     * Terminates the process, escalating to a forced kill once the grace period elapses.
     */
    void destroy(Duration grace);
}
