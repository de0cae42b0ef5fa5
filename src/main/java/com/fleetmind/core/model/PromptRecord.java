package com.fleetmind.core.model;

import java.time.Instant;

/**
 * One instruction sent to a worker.
 */
public record PromptRecord(String workerId, String prompt, Instant timestamp) {}
