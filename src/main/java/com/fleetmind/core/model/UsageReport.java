package com.fleetmind.core.model;

import java.util.Map;

/**
 * Usage figures reported by a worker at the end of a turn. Every field is optional;
 * absent values are {@code null} and leave the accumulated statistics untouched.
 *
 * @param totalCostUsd cost of the turn
 * @param modelUsage   per-model usage breakdown (never null, possibly empty)
 * @param durationApiMs time spent in model calls
 * @param durationMs   wall-clock duration of the turn
 * @param numTurns     number of model turns
 * @param tokensUsed   input plus output tokens, only when positive
 */
public record UsageReport(
    Double totalCostUsd,
    Map<String, ModelUsage> modelUsage,
    Long durationApiMs,
    Long durationMs,
    Integer numTurns,
    Long tokensUsed
) {

    public UsageReport {
        modelUsage = modelUsage != null ? Map.copyOf(modelUsage) : Map.of();
    }
}
