package com.fleetmind.core.pipeline;

import com.fleetmind.core.model.PipelineState;
import com.fleetmind.core.model.StateTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.fleetmind.core.model.PipelineState.*;

/**
 * The legal moves between {@link PipelineState}s.
 * <p>
 * Queries are pure. {@link #applyTransition} validates a move and returns the
 * transition record; it never mutates a pipeline itself.
 */
public final class PipelineStateMachine {

    private static final Map<PipelineState, Set<PipelineState>> TRANSITIONS = new EnumMap<>(PipelineState.class);

    static {
        allow(RECEIVED_TASK, ANALYZING_TASK, PLANNING);
        allow(ANALYZING_TASK, SELECTING_INSTRUCTIONS, FAILED);
        allow(SELECTING_INSTRUCTIONS, GENERATING_SKILLS, PLANNING, FAILED);
        allow(GENERATING_SKILLS, PLANNING, FAILED);
        allow(PLANNING, PLAN_READY, PLANNING, FAILED);
        allow(PLAN_READY, READY_FOR_EXECUTION, PLAN_REVISION_REQUIRED, PLANNING);
        allow(PLAN_REVISION_REQUIRED, PLANNING);
        allow(READY_FOR_EXECUTION, EXECUTING);
        allow(EXECUTING, VERIFYING, FAILED);
        allow(VERIFYING, COMPLETED, PLANNING, READY_FOR_EXECUTION, VERIFICATION_PASSED, VERIFICATION_FAILED, FAILED);
        allow(VERIFICATION_PASSED, COMPLETED);
        allow(VERIFICATION_FAILED, PLANNING, EXECUTING, GAVE_UP);
    }

    private static void allow(PipelineState from, PipelineState... targets) {
        EnumSet<PipelineState> set = EnumSet.noneOf(PipelineState.class);
        Collections.addAll(set, targets);
        TRANSITIONS.put(from, Collections.unmodifiableSet(set));
    }

    private final Clock clock;

    public PipelineStateMachine() {
        this(Clock.systemUTC());
    }

    public PipelineStateMachine(Clock clock) {
        this.clock = clock;
    }

    public boolean canTransition(PipelineState from, PipelineState to) {
        return validTransitionsFrom(from).contains(to);
    }

    public Set<PipelineState> validTransitionsFrom(PipelineState from) {
        return TRANSITIONS.getOrDefault(from, Set.of());
    }

    /**
     * @throws InvalidTransitionException when {@code from -> to} is not in the table
     */
    public StateTransition applyTransition(PipelineState from, PipelineState to, String reason) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        return new StateTransition(from, to, reason, Instant.now(clock));
    }

    public boolean isTerminal(PipelineState state) {
        return state.isTerminal();
    }

    public String phaseName(PipelineState state) {
        return state.phase().displayName();
    }
}
