package com.fleetmind.worker;

import com.fleetmind.FleetmindProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the command line and environment of a worker process.
 */
public class LaunchRequestFactory {

    static final String AGENT_ID_VAR = "CLAUDE_AGENT_ID";
    static final String API_KEY_VAR = "ANTHROPIC_API_KEY";

    private final ExecutableLocator locator;
    private final FleetmindProperties.Worker properties;
    private final Map<String, String> environment;

    public LaunchRequestFactory(ExecutableLocator locator, FleetmindProperties.Worker properties) {
        this(locator, properties, System.getenv());
    }

    LaunchRequestFactory(ExecutableLocator locator, FleetmindProperties.Worker properties,
                         Map<String, String> environment) {
        this.locator = locator;
        this.properties = properties;
        this.environment = environment;
    }

    public LaunchRequest create(String workerId, SpawnRequest request) throws SpawnException {
        List<String> command = new ArrayList<>();
        command.add(locator.locate());
        command.addAll(List.of(
                "-p",
                "--verbose",
                "--permission-mode", "bypassPermissions",
                "--input-format", "stream-json",
                "--output-format", "stream-json"));
        String model = resolveModel(request.model());
        if (model != null) {
            command.add("--model");
            command.add(model);
        }
        return new LaunchRequest(command, request.workingDir(), childEnvironment(workerId));
    }

    String resolveModel(String requested) {
        for (String candidate : new String[]{requested, properties.getDefaultModel(), environment.get("CLAUDE_CODE_MODEL")}) {
            if (candidate != null && !candidate.isBlank()) {
                String model = candidate.trim();
                return "auto".equalsIgnoreCase(model) ? null : model;
            }
        }
        return null;
    }

    Map<String, String> childEnvironment(String workerId) {
        var child = new HashMap<>(environment);
        if ("blocked".equals(apiKeyMode())) {
            child.remove(API_KEY_VAR);
        }
        child.put(AGENT_ID_VAR, workerId);
        return child;
    }

    String apiKeyMode() {
        String mode = properties.getApiKeyMode();
        if (mode == null || mode.isBlank()) {
            mode = environment.getOrDefault("CLAUDE_CODE_API_KEY_MODE", "blocked");
        }
        return mode.trim().toLowerCase(Locale.ROOT);
    }
}
