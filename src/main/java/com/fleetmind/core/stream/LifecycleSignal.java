package com.fleetmind.core.stream;

/**
 * What a parsed line says about the worker's turn.
 */
public enum LifecycleSignal {
    /** The worker called at least one tool and keeps working. */
    TOOL_INVOKED,
    /** The assistant ended its turn. */
    TURN_ENDED,
    /** A result message reported success. */
    TURN_SUCCEEDED,
    /** A result message reported anything other than success. The worker's flags stay unchanged. */
    TURN_FAILED,
    /** The assistant is mid-turn. */
    CONTINUING,
    NONE;

    /** True for signals after which the worker waits for the next prompt. */
    public boolean endsTurn() {
        return this == TURN_ENDED || this == TURN_SUCCEEDED;
    }
}
