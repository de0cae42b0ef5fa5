package com.fleetmind.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Audit entry for one decision taken on a pipeline.
 */
public record IterationRecord(
    int iteration,
    DecisionType decision,
    String reasoning,
    List<String> issues,
    List<String> suggestions,
    Instant timestamp
) {

    public static IterationRecord of(int iteration, Decision decision, Instant timestamp) {
        return new IterationRecord(iteration, decision.type(), decision.reasoning(),
                decision.issues(), decision.suggestions(), timestamp);
    }
}
