package com.fleetmind.core.pipeline;

import com.fleetmind.core.model.PipelineState;
import com.fleetmind.core.model.StateTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static com.fleetmind.core.model.PipelineState.*;
import static org.junit.jupiter.api.Assertions.*;

class PipelineStateMachineTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final PipelineStateMachine machine = new PipelineStateMachine(Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("Transition table")
    class TableTests {

        @Test
        @DisplayName("happy path from received task to completed is legal")
        void happyPath() {
            PipelineState[] path = {RECEIVED_TASK, PLANNING, PLAN_READY, READY_FOR_EXECUTION, EXECUTING,
                    VERIFYING, VERIFICATION_PASSED, COMPLETED};
            for (int i = 0; i < path.length - 1; i++) {
                assertTrue(machine.canTransition(path[i], path[i + 1]), path[i] + " -> " + path[i + 1]);
            }
        }

        @Test
        @DisplayName("verification can loop back to build or planning")
        void verificationLoops() {
            assertTrue(machine.canTransition(VERIFYING, READY_FOR_EXECUTION));
            assertTrue(machine.canTransition(VERIFYING, PLANNING));
            assertTrue(machine.canTransition(VERIFICATION_FAILED, EXECUTING));
            assertTrue(machine.canTransition(VERIFICATION_FAILED, GAVE_UP));
        }

        @Test
        @DisplayName("planning may restart itself")
        void planningSelfLoop() {
            assertTrue(machine.canTransition(PLANNING, PLANNING));
        }

        @Test
        @DisplayName("shortcuts are rejected")
        void shortcutsRejected() {
            assertFalse(machine.canTransition(RECEIVED_TASK, EXECUTING));
            assertFalse(machine.canTransition(PLAN_READY, COMPLETED));
            assertFalse(machine.canTransition(READY_FOR_EXECUTION, FAILED));
            assertFalse(machine.canTransition(EXECUTING, COMPLETED));
        }

        @Test
        @DisplayName("valid targets of plan ready")
        void validTargets() {
            assertEquals(Set.of(READY_FOR_EXECUTION, PLAN_REVISION_REQUIRED, PLANNING),
                    machine.validTransitionsFrom(PLAN_READY));
        }

        @Test
        @DisplayName("terminal states have no way out")
        void terminalStatesAreSinks() {
            for (PipelineState terminal : Set.of(COMPLETED, FAILED, GAVE_UP)) {
                assertTrue(machine.isTerminal(terminal));
                assertTrue(machine.validTransitionsFrom(terminal).isEmpty());
                for (PipelineState target : PipelineState.values()) {
                    assertFalse(machine.canTransition(terminal, target), terminal + " -> " + target);
                }
            }
        }
    }

    @Nested
    @DisplayName("applyTransition")
    class ApplyTests {

        @Test
        @DisplayName("returns a timestamped transition record")
        void returnsRecord() {
            StateTransition t = machine.applyTransition(EXECUTING, VERIFYING, "Build finished");

            assertEquals(EXECUTING, t.from());
            assertEquals(VERIFYING, t.to());
            assertEquals("Build finished", t.reason());
            assertEquals(NOW, t.timestamp());
        }

        @Test
        @DisplayName("illegal move throws with both states")
        void illegalMoveThrows() {
            var e = assertThrows(InvalidTransitionException.class,
                    () -> machine.applyTransition(COMPLETED, PLANNING, "again"));
            assertEquals(COMPLETED, e.getFrom());
            assertEquals(PLANNING, e.getTo());
        }
    }

    @Test
    @DisplayName("phase names group states for reporting")
    void phaseNames() {
        assertEquals("Planning", machine.phaseName(PLAN_READY));
        assertEquals("Execution", machine.phaseName(EXECUTING));
        assertEquals("Verification", machine.phaseName(VERIFICATION_FAILED));
        assertEquals("Terminal", machine.phaseName(GAVE_UP));
        assertEquals("Skill Synthesis", machine.phaseName(ANALYZING_TASK));
        assertFalse(machine.isTerminal(VERIFYING));
    }
}
