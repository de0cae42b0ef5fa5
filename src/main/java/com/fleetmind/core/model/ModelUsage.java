package com.fleetmind.core.model;

/**
 * Token and cost usage attributed to one model.
 * <p>
 * {@code contextWindow} and {@code maxOutputTokens} describe the model rather than
 * the traffic, so a merge keeps the values already recorded.
 */
public record ModelUsage(
    long inputTokens,
    long outputTokens,
    long cacheCreationInputTokens,
    long cacheReadInputTokens,
    double costUsd,
    Long contextWindow,
    Long maxOutputTokens
) {

    public static final ModelUsage EMPTY = new ModelUsage(0, 0, 0, 0, 0.0, null, null);

    public ModelUsage merge(ModelUsage other) {
        return new ModelUsage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                cacheCreationInputTokens + other.cacheCreationInputTokens,
                cacheReadInputTokens + other.cacheReadInputTokens,
                costUsd + other.costUsd,
                contextWindow != null ? contextWindow : other.contextWindow,
                maxOutputTokens != null ? maxOutputTokens : other.maxOutputTokens);
    }

    public long totalTokens() {
        return inputTokens + outputTokens + cacheCreationInputTokens + cacheReadInputTokens;
    }
}
