package com.fleetmind.core.model;

import java.util.Map;

/**
 * Aggregate figures across all stored runs.
 */
public record RunStats(
    long totalRuns,
    Map<String, Long> byStatus,
    Map<String, Long> bySource,
    double totalCostUsd,
    long resumableRuns
) {}
