package com.fleetmind.worker;

import java.io.IOException;

/**
 * Starts worker processes.
 * Implementations: {@link LocalProcessLauncher} (OS processes); tests substitute in-memory fakes.
 */
public interface WorkerLauncher {

    /**
     * Starts a process with stdin, stdout and stderr piped.
     *
     * @throws IOException when the OS refuses to start the process
     */
    WorkerProcess launch(LaunchRequest request) throws IOException;
}
