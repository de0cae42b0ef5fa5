package com.fleetmind.core.model;

import java.time.Instant;

/**
 * One applied state change of a pipeline.
 */
public record StateTransition(PipelineState from, PipelineState to, String reason, Instant timestamp) {}
