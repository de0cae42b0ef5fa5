package com.fleetmind.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One orchestrated task and everything recorded while driving it.
 * <p>
 * Only the orchestrator mutates a pipeline, and only through
 * {@code PipelineRegistry.update}; everyone else works on {@link #copy()}s.
 */
public class Pipeline {

    private final String id;
    private final String userRequest;
    private final String workingDir;
    private final String model;
    private final int maxIterations;
    private final Instant createdAt;

    private PipelineState state = PipelineState.RECEIVED_TASK;
    private final List<PipelineStep> steps = new ArrayList<>();
    private final List<String> questions = new ArrayList<>();
    private final List<String> answers = new ArrayList<>();
    private final List<String> carriedContext = new ArrayList<>();
    private int currentIteration = 1;
    private final List<IterationRecord> iterationHistory = new ArrayList<>();
    private final List<StateTransition> transitions = new ArrayList<>();
    private DecisionType finalDecision;
    private String failureReason;
    private Instant completedAt;

    public Pipeline(String id, String userRequest, String workingDir, String model,
                    int maxIterations, Instant createdAt) {
        this.id = id;
        this.userRequest = userRequest;
        this.workingDir = workingDir;
        this.model = model;
        this.maxIterations = Math.max(0, maxIterations);
        this.createdAt = createdAt;
        for (StepRole role : StepRole.values()) {
            steps.add(new PipelineStep(role));
        }
    }

    public PipelineStep step(StepRole role) {
        return steps.get(role.stepNumber() - 1);
    }

    /**
     * True when moving to the next iteration would exceed a bounded iteration budget.
     */
    public boolean wouldExceedIterationLimit() {
        return maxIterations > 0 && currentIteration + 1 > maxIterations;
    }

    /** Starts another build pass: build and verify steps are reset, the plan is kept. */
    public void resetForIteration() {
        currentIteration++;
        step(StepRole.BUILDING).reset();
        step(StepRole.VERIFYING).reset();
    }

    /** Starts over from planning: every step is reset. */
    public void resetForReplan() {
        currentIteration++;
        steps.forEach(PipelineStep::reset);
    }

    public void applyTransition(StateTransition transition) {
        transitions.add(transition);
        state = transition.to();
    }

    public void recordDecision(IterationRecord record) {
        iterationHistory.add(record);
    }

    public void addContext(String context) {
        carriedContext.add(context);
    }

    public void setQuestions(List<String> newQuestions) {
        questions.clear();
        questions.addAll(newQuestions);
        answers.clear();
    }

    public void setAnswers(List<String> newAnswers) {
        answers.clear();
        answers.addAll(newAnswers);
    }

    public void markFinished(DecisionType decision, String reason, Instant at) {
        finalDecision = decision;
        failureReason = reason;
        completedAt = at;
    }

    public Pipeline copy() {
        var c = new Pipeline(id, userRequest, workingDir, model, maxIterations, createdAt);
        c.state = state;
        c.steps.clear();
        steps.forEach(s -> c.steps.add(s.copy()));
        c.questions.addAll(questions);
        c.answers.addAll(answers);
        c.carriedContext.addAll(carriedContext);
        c.currentIteration = currentIteration;
        c.iterationHistory.addAll(iterationHistory);
        c.transitions.addAll(transitions);
        c.finalDecision = finalDecision;
        c.failureReason = failureReason;
        c.completedAt = completedAt;
        return c;
    }

    public String getId() { return id; }
    public String getUserRequest() { return userRequest; }
    public String getWorkingDir() { return workingDir; }
    public String getModel() { return model; }
    public int getMaxIterations() { return maxIterations; }
    public Instant getCreatedAt() { return createdAt; }
    public PipelineState getState() { return state; }
    public List<PipelineStep> getSteps() { return Collections.unmodifiableList(steps); }
    public List<String> getQuestions() { return Collections.unmodifiableList(questions); }
    public List<String> getAnswers() { return Collections.unmodifiableList(answers); }
    public List<String> getCarriedContext() { return Collections.unmodifiableList(carriedContext); }
    public int getCurrentIteration() { return currentIteration; }
    public List<IterationRecord> getIterationHistory() { return Collections.unmodifiableList(iterationHistory); }
    public List<StateTransition> getTransitions() { return Collections.unmodifiableList(transitions); }
    public DecisionType getFinalDecision() { return finalDecision; }
    public String getFailureReason() { return failureReason; }
    public Instant getCompletedAt() { return completedAt; }
}
