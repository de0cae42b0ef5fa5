package com.fleetmind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    private Pipeline pipeline(int maxIterations) {
        return new Pipeline("PIPE-2026-0001", "task", "/work", null, maxIterations, Instant.now());
    }

    @Test
    @DisplayName("a new pipeline starts at iteration 1 with three pending steps")
    void initialState() {
        var pipeline = pipeline(3);
        assertEquals(PipelineState.RECEIVED_TASK, pipeline.getState());
        assertEquals(1, pipeline.getCurrentIteration());
        assertEquals(3, pipeline.getSteps().size());
        assertTrue(pipeline.getSteps().stream().allMatch(s -> s.getStatus() == StepStatus.PENDING));
    }

    @Test
    @DisplayName("iteration limit counts the pass that would start next")
    void iterationLimit() {
        var pipeline = pipeline(2);
        assertFalse(pipeline.wouldExceedIterationLimit());
        pipeline.resetForIteration();
        assertTrue(pipeline.wouldExceedIterationLimit());

        var unbounded = pipeline(0);
        for (int i = 0; i < 10; i++) {
            unbounded.resetForIteration();
        }
        assertFalse(unbounded.wouldExceedIterationLimit());
    }

    @Test
    @DisplayName("iterating keeps the plan, replanning clears it")
    void resets() {
        var pipeline = pipeline(5);
        pipeline.step(StepRole.PLANNING).setOutput(new StepOutput("plan", null));
        pipeline.step(StepRole.BUILDING).setOutput(new StepOutput("built", null));

        pipeline.resetForIteration();
        assertNotNull(pipeline.step(StepRole.PLANNING).getOutput());
        assertNull(pipeline.step(StepRole.BUILDING).getOutput());

        pipeline.resetForReplan();
        assertNull(pipeline.step(StepRole.PLANNING).getOutput());
        assertEquals(3, pipeline.getCurrentIteration());
    }

    @Test
    @DisplayName("new questions clear earlier answers; copies are independent")
    void questionsAndCopies() {
        var pipeline = pipeline(5);
        pipeline.setQuestions(List.of("a?"));
        pipeline.setAnswers(List.of("yes"));
        pipeline.setQuestions(List.of("b?"));
        assertTrue(pipeline.getAnswers().isEmpty());

        var copy = pipeline.copy();
        copy.addContext("only on copy");
        copy.step(StepRole.PLANNING).setStatus(StepStatus.RUNNING);
        assertTrue(pipeline.getCarriedContext().isEmpty());
        assertEquals(StepStatus.PENDING, pipeline.step(StepRole.PLANNING).getStatus());
    }
}
