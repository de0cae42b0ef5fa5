package com.fleetmind.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Artifact captured from a step's worker: its final text and, when that text
 * is JSON, the parsed tree.
 */
public record StepOutput(String rawText, JsonNode structuredData) {

    public static final StepOutput EMPTY = new StepOutput("", null);

    public Optional<JsonNode> structured() {
        return Optional.ofNullable(structuredData);
    }

    public boolean isBlank() {
        return rawText == null || rawText.isBlank();
    }
}
