package com.fleetmind.core.pipeline;

import com.fleetmind.core.model.PipelineState;

/**
 * Thrown when a pipeline is asked to move between two states with no edge in the transition table.
 */
public class InvalidTransitionException extends RuntimeException {

    private final PipelineState from;
    private final PipelineState to;

    public InvalidTransitionException(PipelineState from, PipelineState to) {
        super("Invalid pipeline transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public PipelineState getFrom() {
        return from;
    }

    public PipelineState getTo() {
        return to;
    }
}
