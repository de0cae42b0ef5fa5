package com.fleetmind.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the worker executable.
 * <p>
 * Lookup order: the configured path, {@code CLAUDE_PATH}, then the usual install
 * locations under the home directory and the system prefixes. When nothing is found
 * the bare command name is returned and left to the OS {@code PATH} lookup.
 */
public class ExecutableLocator {

    private static final Logger log = LoggerFactory.getLogger(ExecutableLocator.class);

    static final String COMMAND_NAME = "claude";

    private final String configured;
    private final Map<String, String> environment;
    private final Path home;
    private final List<Path> systemLocations;

    public ExecutableLocator(String configured) {
        this(configured, System.getenv(), Path.of(System.getProperty("user.home")),
                List.of(Path.of("/usr/local/bin", COMMAND_NAME), Path.of("/opt/homebrew/bin", COMMAND_NAME)));
    }

    ExecutableLocator(String configured, Map<String, String> environment, Path home, List<Path> systemLocations) {
        this.configured = configured;
        this.environment = environment;
        this.home = home;
        this.systemLocations = List.copyOf(systemLocations);
    }

    /**
     * @throws SpawnException when an explicitly configured executable does not exist
     */
    public String locate() throws SpawnException {
        if (configured != null && !configured.isBlank()) {
            if (!Files.exists(Path.of(configured))) {
                throw new SpawnException("Configured worker executable not found: " + configured);
            }
            return configured;
        }
        String fromEnv = environment.get("CLAUDE_PATH");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        return candidates().stream()
                .filter(Files::exists)
                .findFirst()
                .map(Path::toString)
                .orElseGet(() -> {
                    log.debug("No worker executable in known locations, relying on PATH");
                    return COMMAND_NAME;
                });
    }

    List<Path> candidates() {
        var candidates = new ArrayList<Path>();
        if (home != null) {
            candidates.add(home.resolve(".local/bin").resolve(COMMAND_NAME));
            nvmInstall(home.resolve(".nvm/versions/node")).ifPresent(candidates::add);
        }
        candidates.addAll(systemLocations);
        return candidates;
    }

    private static Optional<Path> nvmInstall(Path nodeVersions) {
        if (!Files.isDirectory(nodeVersions)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> versions = Files.newDirectoryStream(nodeVersions)) {
            for (Path version : versions) {
                Path candidate = version.resolve("bin").resolve(COMMAND_NAME);
                if (Files.exists(candidate)) {
                    return Optional.of(candidate);
                }
            }
        } catch (IOException e) {
            log.debug("Could not list {}: {}", nodeVersions, e.getMessage());
        }
        return Optional.empty();
    }
}
