package com.fleetmind.worker;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved OS process launch.
 *
 * @param command     executable followed by its arguments
 * @param workingDir  process working directory
 * @param environment the complete child environment
 */
public record LaunchRequest(
    List<String> command,
    Path workingDir,
    Map<String, String> environment
) {

    public LaunchRequest {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
