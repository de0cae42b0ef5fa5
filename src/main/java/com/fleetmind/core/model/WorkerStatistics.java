package com.fleetmind.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monotonically accumulating counters for one worker.
 * <p>
 * Not thread-safe: the owning worker guards every mutation. Readers receive an
 * immutable {@link Snapshot}.
 */
public class WorkerStatistics {

    private long totalPrompts;
    private long totalToolCalls;
    private long totalOutputBytes;
    private final Instant sessionStart;
    private Instant lastActivity;
    private Long totalTokensUsed;
    private Double totalCostUsd;
    private final Map<String, ModelUsage> modelUsage = new LinkedHashMap<>();
    private Long durationApiMs;
    private Long durationMs;
    private Integer numTurns;

    public WorkerStatistics(Instant sessionStart) {
        this.sessionStart = sessionStart;
        this.lastActivity = sessionStart;
    }

    public void recordPrompt(Instant at) {
        totalPrompts++;
        lastActivity = at;
    }

    public void recordToolCalls(int count, Instant at) {
        if (count > 0) {
            totalToolCalls += count;
            lastActivity = at;
        }
    }

    public void recordOutput(long bytes, Instant at) {
        totalOutputBytes += bytes;
        lastActivity = at;
    }

    /**
     * Merges a turn's usage report. Every figure is added to what is already
     * recorded; per-model usage for a model seen before is summed, never replaced.
     */
    public void merge(UsageReport report, Instant at) {
        if (report.totalCostUsd() != null) {
            totalCostUsd = (totalCostUsd != null ? totalCostUsd : 0.0) + report.totalCostUsd();
        }
        report.modelUsage().forEach((model, usage) ->
                modelUsage.merge(model, usage, ModelUsage::merge));
        if (report.durationApiMs() != null) {
            durationApiMs = (durationApiMs != null ? durationApiMs : 0L) + report.durationApiMs();
        }
        if (report.durationMs() != null) {
            durationMs = (durationMs != null ? durationMs : 0L) + report.durationMs();
        }
        if (report.numTurns() != null) {
            numTurns = (numTurns != null ? numTurns : 0) + report.numTurns();
        }
        if (report.tokensUsed() != null) {
            totalTokensUsed = (totalTokensUsed != null ? totalTokensUsed : 0L) + report.tokensUsed();
        }
        lastActivity = at;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public Snapshot snapshot() {
        return new Snapshot(totalPrompts, totalToolCalls, totalOutputBytes, sessionStart, lastActivity,
                totalTokensUsed, totalCostUsd, Map.copyOf(modelUsage), durationApiMs, durationMs, numTurns);
    }

    /**
     * Immutable copy of the counters at one point in time.
     */
    public record Snapshot(
        long totalPrompts,
        long totalToolCalls,
        long totalOutputBytes,
        Instant sessionStart,
        Instant lastActivity,
        Long totalTokensUsed,
        Double totalCostUsd,
        Map<String, ModelUsage> modelUsage,
        Long durationApiMs,
        Long durationMs,
        Integer numTurns
    ) {}
}
