package com.fleetmind.core.model;

/**
 * Phases a pipeline passes through. Legal moves between them are defined by
 * {@code PipelineStateMachine}.
 */
public enum PipelineState {
    RECEIVED_TASK("Received Task", Phase.SKILL_SYNTHESIS),
    ANALYZING_TASK("Analyzing Task", Phase.SKILL_SYNTHESIS),
    SELECTING_INSTRUCTIONS("Selecting Instructions", Phase.SKILL_SYNTHESIS),
    GENERATING_SKILLS("Generating Skills", Phase.SKILL_SYNTHESIS),
    PLANNING("Planning", Phase.PLANNING),
    PLAN_READY("Plan Ready", Phase.PLANNING),
    PLAN_REVISION_REQUIRED("Plan Revision Required", Phase.PLANNING),
    READY_FOR_EXECUTION("Ready for Execution", Phase.EXECUTION),
    EXECUTING("Executing", Phase.EXECUTION),
    VERIFYING("Verifying", Phase.VERIFICATION),
    VERIFICATION_PASSED("Verification Passed", Phase.VERIFICATION),
    VERIFICATION_FAILED("Verification Failed", Phase.VERIFICATION),
    COMPLETED("Completed", Phase.TERMINAL),
    FAILED("Failed", Phase.TERMINAL),
    GAVE_UP("Gave Up", Phase.TERMINAL);

    private final String displayName;
    private final Phase phase;

    PipelineState(String displayName, Phase phase) {
        this.displayName = displayName;
        this.phase = phase;
    }

    public String displayName() {
        return displayName;
    }

    public Phase phase() {
        return phase;
    }

    public boolean isTerminal() {
        return phase == Phase.TERMINAL;
    }

    public enum Phase {
        SKILL_SYNTHESIS("Skill Synthesis"),
        PLANNING("Planning"),
        EXECUTION("Execution"),
        VERIFICATION("Verification"),
        TERMINAL("Terminal");

        private final String displayName;

        Phase(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }
}
