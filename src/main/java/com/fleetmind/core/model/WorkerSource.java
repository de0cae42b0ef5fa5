package com.fleetmind.core.model;

/**
 * Provenance of a worker: who asked for it to be spawned.
 */
public enum WorkerSource {
    UI("ui"),
    PIPELINE("pipeline"),
    CLI("cli");

    private final String wireName;

    WorkerSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static WorkerSource fromWireName(String name) {
        for (WorkerSource source : values()) {
            if (source.wireName.equals(name)) {
                return source;
            }
        }
        return UI;
    }
}
