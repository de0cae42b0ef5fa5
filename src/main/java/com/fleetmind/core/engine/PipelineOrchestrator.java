package com.fleetmind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.events.EventBus;
import com.fleetmind.core.events.EventTypes;
import com.fleetmind.core.events.FleetEvent;
import com.fleetmind.core.logging.MdcContext;
import com.fleetmind.core.metrics.FleetmindMetrics;
import com.fleetmind.core.model.Decision;
import com.fleetmind.core.model.DecisionType;
import com.fleetmind.core.model.IterationRecord;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.PipelineState;
import com.fleetmind.core.model.PipelineStep;
import com.fleetmind.core.model.StateTransition;
import com.fleetmind.core.model.StepOutput;
import com.fleetmind.core.model.StepRole;
import com.fleetmind.core.model.StepStatus;
import com.fleetmind.core.pipeline.PipelineStateMachine;
import com.fleetmind.core.verdict.DecisionEvaluator;
import com.fleetmind.worker.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives pipelines through plan, build and verify until they complete, give up or fail.
 * <p>
 * A pipeline runs its steps one at a time on the calling thread, each on a fresh worker.
 * The previous step's worker is stopped before the next one is spawned, and every worker
 * the pipeline spawned is stopped when it reaches a terminal state.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String MAX_ITERATIONS_REASON = "max_iterations";

    private final AtomicInteger pipelineCounter = new AtomicInteger(0);

    private final PipelineRegistry registry;
    private final PipelineStateMachine stateMachine;
    private final StepExecutor stepExecutor;
    private final DecisionEvaluator evaluator;
    private final WorkerSupervisor supervisor;
    private final EventBus eventBus;
    private final FleetmindMetrics metrics;
    private final ExecutorService executor;
    private final int defaultMaxIterations;

    private final ConcurrentHashMap<String, Set<String>> pipelineWorkers = new ConcurrentHashMap<>();

    public PipelineOrchestrator(PipelineRegistry registry, PipelineStateMachine stateMachine,
                                StepExecutor stepExecutor, DecisionEvaluator evaluator,
                                WorkerSupervisor supervisor,
                                EventBus eventBus, FleetmindMetrics metrics,
                                @Qualifier("pipelineExecutor") ExecutorService executor,
                                FleetmindProperties properties) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.stepExecutor = stepExecutor;
        this.evaluator = evaluator;
        this.supervisor = supervisor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
        this.defaultMaxIterations = properties.getPipeline().getMaxIterations();
    }

    public Pipeline submit(String request, String workingDir) {
        return submit(request, workingDir, defaultMaxIterations, null);
    }

    /**
     * Registers a new pipeline in RECEIVED_TASK.
     *
     * @param maxIterations iteration budget, 0 for unbounded
     * @param model         worker model override (nullable)
     */
    public Pipeline submit(String request, String workingDir, int maxIterations, String model) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Request must not be blank");
        }
        if (workingDir == null || workingDir.isBlank()) {
            throw new IllegalArgumentException("Working directory must not be blank");
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Max iterations must not be negative");
        }
        var pipeline = new Pipeline(generatePipelineId(), request, workingDir, model, maxIterations, Instant.now());
        registry.register(pipeline);
        log.info("Submitted pipeline {} in {} (max iterations {}): {}",
                pipeline.getId(), workingDir, maxIterations == 0 ? "unbounded" : maxIterations, request);
        eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_CREATED, pipeline.getId(),
                Map.of("request", request, "workingDir", workingDir, "maxIterations", maxIterations)));
        return pipeline.copy();
    }

    public CompletableFuture<Pipeline> start(String pipelineId) {
        return CompletableFuture.supplyAsync(() -> run(pipelineId), executor);
    }

    /**
     * Drives the pipeline to a terminal state on the calling thread.
     *
     * @return the pipeline in its terminal state
     * @throws IllegalArgumentException when the pipeline is unknown
     */
    public Pipeline run(String pipelineId) {
        Pipeline pipeline = registry.snapshot(pipelineId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline: " + pipelineId));
        if (pipeline.getState().isTerminal()) {
            return pipeline;
        }
        MdcContext.setPipeline(pipelineId);
        try {
            return drive(new RunContext(pipelineId));
        } catch (StepFailedException e) {
            log.error("Pipeline {} failed in {} step: {}", pipelineId, e.getRole().wireName(), e.getMessage());
            return fail(pipelineId, e.getMessage(), Map.of("reason", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Pipeline {} aborted: {}", pipelineId, e.getMessage(), e);
            return fail(pipelineId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    Map.of("reason", String.valueOf(e.getMessage())));
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<Pipeline> get(String pipelineId) {
        return registry.snapshot(pipelineId);
    }

    public List<Pipeline> list() {
        return registry.list();
    }

    private Pipeline drive(RunContext ctx) {
        String id = ctx.pipelineId;
        transition(id, PipelineState.PLANNING, "Task received");
        Stage next = Stage.PLAN;
        while (true) {
            switch (next) {
                case PLAN -> {
                    runPlanning(ctx);
                    next = Stage.BUILD;
                }
                case BUILD -> {
                    transition(id, PipelineState.EXECUTING, "Starting build");
                    Pipeline current = snapshot(id);
                    runStep(ctx, StepRole.BUILDING, PromptTemplates.build(current));
                    next = Stage.VERIFY;
                }
                case VERIFY -> {
                    transition(id, PipelineState.VERIFYING, "Build finished");
                    StepOutput report = runStep(ctx, StepRole.VERIFYING, PromptTemplates.verification(snapshot(id)));
                    Decision decision = decide(id, report);
                    switch (decision.type()) {
                        case COMPLETE -> {
                            return complete(id, decision);
                        }
                        case GIVE_UP -> {
                            return giveUp(id, decision);
                        }
                        case ITERATE, REPLAN -> {
                            Pipeline current = snapshot(id);
                            if (current.wouldExceedIterationLimit()) {
                                return failMaxIterations(id, current);
                            }
                            if (decision.type() == DecisionType.ITERATE) {
                                prepareIteration(id, decision);
                                next = Stage.BUILD;
                            } else {
                                ctx.previousAttempt = PromptTemplates.PreviousAttempt.of(current, decision);
                                prepareReplan(id, decision);
                                next = Stage.PLAN;
                            }
                        }
                    }
                }
            }
        }
    }

    private void runPlanning(RunContext ctx) {
        String id = ctx.pipelineId;
        Pipeline current = snapshot(id);
        String prompt = ctx.previousAttempt != null
                ? PromptTemplates.replan(current, ctx.previousAttempt)
                : PromptTemplates.planning(current);

        StepOutput plan = runStep(ctx, StepRole.PLANNING, prompt);
        if (plan.isBlank()) {
            log.warn("Pipeline {} produced an empty plan, planning once more", id);
            transition(id, PipelineState.PLANNING, "Empty plan");
            plan = runStep(ctx, StepRole.PLANNING, prompt);
            if (plan.isBlank()) {
                throw new StepFailedException(StepRole.PLANNING, "Planning produced no plan");
            }
        }

        List<String> questions = plan.structured()
                .map(json -> json.get("questions"))
                .map(PipelineOrchestrator::stringList)
                .orElse(List.of());
        registry.update(id, p -> p.setQuestions(questions));
        ctx.previousAttempt = null;

        transition(id, PipelineState.PLAN_READY, "Plan produced");
        transition(id, PipelineState.READY_FOR_EXECUTION, "Plan accepted");
    }

    /**
     * Runs one step on a fresh worker after stopping the previous step's worker.
     */
    private StepOutput runStep(RunContext ctx, StepRole role, String prompt) {
        String id = ctx.pipelineId;
        if (ctx.lastWorkerId != null) {
            supervisor.stop(ctx.lastWorkerId);
            ctx.lastWorkerId = null;
        }

        Instant startedAt = Instant.now();
        Pipeline current = registry.update(id, p -> {
            PipelineStep step = p.step(role);
            step.reset();
            step.setStatus(StepStatus.RUNNING);
            step.setStartedAt(startedAt);
        });
        MdcContext.setStep(id, role.wireName(), current.getCurrentIteration());
        publishStepStatus(id, role, StepStatus.RUNNING, null);

        try {
            String workerId = stepExecutor.spawn(current, role);
            ctx.lastWorkerId = workerId;
            pipelineWorkers.computeIfAbsent(id, k -> ConcurrentHashMap.newKeySet()).add(workerId);
            registry.update(id, p -> p.step(role).setWorkerId(workerId));
            publishStepStatus(id, role, StepStatus.RUNNING, workerId);

            StepOutput output = stepExecutor.execute(workerId, role, prompt);

            Instant completedAt = Instant.now();
            registry.update(id, p -> {
                PipelineStep step = p.step(role);
                step.setStatus(StepStatus.COMPLETED);
                step.setOutput(output);
                step.setCompletedAt(completedAt);
            });
            metrics.recordStepDuration(role.wireName(), completedAt.toEpochMilli() - startedAt.toEpochMilli());
            var payload = new HashMap<String, Object>();
            payload.put("step", role.stepNumber());
            payload.put("role", role.wireName());
            payload.put("workerId", workerId);
            payload.put("structured", output.structured().isPresent());
            eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_STEP_COMPLETED, id, payload));
            return output;
        } catch (StepFailedException e) {
            registry.update(id, p -> {
                p.step(role).setStatus(StepStatus.FAILED);
                p.step(role).setCompletedAt(Instant.now());
            });
            publishStepStatus(id, role, StepStatus.FAILED, ctx.lastWorkerId);
            throw e;
        } finally {
            MdcContext.setPipeline(id);
        }
    }

    private Decision decide(String pipelineId, StepOutput report) {
        Decision decision = evaluator.evaluate(report);
        Pipeline current = registry.update(pipelineId,
                p -> p.recordDecision(IterationRecord.of(p.getCurrentIteration(), decision, Instant.now())));
        metrics.recordDecision(decision.type().wireName());
        log.info("Pipeline {} iteration {} decision: {} {}", pipelineId, current.getCurrentIteration(),
                decision.type().wireName(), decision.reasoning());

        var payload = new HashMap<String, Object>();
        payload.put("iteration", current.getCurrentIteration());
        payload.put("decision", decision.type().wireName());
        payload.put("reasoning", decision.reasoning());
        payload.put("issues", decision.issues());
        payload.put("suggestions", decision.suggestions());
        eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_DECISION, pipelineId, payload));
        return decision;
    }

    private void prepareIteration(String pipelineId, Decision decision) {
        Pipeline current = registry.update(pipelineId, p -> {
            p.addContext(feedback(p.getCurrentIteration(), decision));
            p.resetForIteration();
        });
        log.info("Pipeline {} starting iteration {} with {} issues to fix",
                pipelineId, current.getCurrentIteration(), decision.issues().size());
        transition(pipelineId, PipelineState.READY_FOR_EXECUTION, "Iterating on verification feedback");
    }

    private void prepareReplan(String pipelineId, Decision decision) {
        Pipeline current = registry.update(pipelineId, p -> {
            p.addContext(feedback(p.getCurrentIteration(), decision));
            p.resetForReplan();
        });
        log.info("Pipeline {} replanning for iteration {}", pipelineId, current.getCurrentIteration());
        transition(pipelineId, PipelineState.PLANNING, "Replanning: " + decision.reasoning());
    }

    private Pipeline complete(String pipelineId, Decision decision) {
        transition(pipelineId, PipelineState.VERIFICATION_PASSED, "Verification passed");
        transition(pipelineId, PipelineState.COMPLETED, decision.reasoning());
        Pipeline done = finish(pipelineId, DecisionType.COMPLETE, null);
        publishCompleted(pipelineId, "success", Map.of("decision", "complete", "summary", decision.reasoning()));
        return done;
    }

    private Pipeline giveUp(String pipelineId, Decision decision) {
        transition(pipelineId, PipelineState.VERIFICATION_FAILED, "Verification failed");
        transition(pipelineId, PipelineState.GAVE_UP, decision.reasoning());
        Pipeline done = finish(pipelineId, DecisionType.GIVE_UP, decision.reasoning());
        publishCompleted(pipelineId, "failed", Map.of("decision", "give_up", "reason", decision.reasoning()));
        return done;
    }

    private Pipeline failMaxIterations(String pipelineId, Pipeline current) {
        log.warn("Pipeline {} reached its limit of {} iterations", pipelineId, current.getMaxIterations());
        transition(pipelineId, PipelineState.FAILED, MAX_ITERATIONS_REASON);
        Pipeline done = finish(pipelineId, null, MAX_ITERATIONS_REASON);
        publishCompleted(pipelineId, "failed", Map.of("reason", "max_iterations_reached",
                "iterations", current.getCurrentIteration()));
        return done;
    }

    private Pipeline fail(String pipelineId, String reason, Map<String, Object> details) {
        Pipeline current = snapshot(pipelineId);
        if (stateMachine.canTransition(current.getState(), PipelineState.FAILED)) {
            transition(pipelineId, PipelineState.FAILED, reason);
        } else if (!current.getState().isTerminal()) {
            log.warn("Pipeline {} cannot move from {} to FAILED; recording failure without transition",
                    pipelineId, current.getState());
        }
        Pipeline done = finish(pipelineId, null, reason);
        publishCompleted(pipelineId, "failed", details);
        return done;
    }

    private Pipeline finish(String pipelineId, DecisionType decision, String reason) {
        Set<String> workers = pipelineWorkers.remove(pipelineId);
        if (workers != null) {
            supervisor.stopAll(workers);
        }
        Pipeline done = registry.update(pipelineId, p -> p.markFinished(decision, reason, Instant.now()));
        metrics.recordPipelineResult(done.getState().name());
        metrics.recordIterationDepth(done.getCurrentIteration());
        log.info("Pipeline {} finished as {} after {} iteration(s)", pipelineId,
                done.getState().displayName(), done.getCurrentIteration());
        return done;
    }

    private void transition(String pipelineId, PipelineState to, String reason) {
        var applied = new StateTransition[1];
        registry.update(pipelineId, p -> {
            applied[0] = stateMachine.applyTransition(p.getState(), to, reason);
            p.applyTransition(applied[0]);
        });
        StateTransition t = applied[0];
        log.debug("Pipeline {}: {} -> {} ({})", pipelineId, t.from(), t.to(), reason);
        var payload = new HashMap<String, Object>();
        payload.put("from", t.from().name());
        payload.put("to", t.to().name());
        payload.put("displayName", t.to().displayName());
        payload.put("phase", stateMachine.phaseName(t.to()));
        payload.put("reason", reason != null ? reason : "");
        eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_STATE_CHANGED, pipelineId, payload));
    }

    private void publishStepStatus(String pipelineId, StepRole role, StepStatus status, String workerId) {
        var payload = new HashMap<String, Object>();
        payload.put("step", role.stepNumber());
        payload.put("role", role.wireName());
        payload.put("status", status.wireName());
        if (workerId != null) {
            payload.put("workerId", workerId);
        }
        eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_STEP_STATUS, pipelineId, payload));
    }

    private void publishCompleted(String pipelineId, String status, Map<String, Object> details) {
        var payload = new HashMap<String, Object>(details);
        payload.put("status", status);
        eventBus.publish(FleetEvent.forPipeline(EventTypes.PIPELINE_COMPLETED, pipelineId, payload));
    }

    private Pipeline snapshot(String pipelineId) {
        return registry.snapshot(pipelineId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline: " + pipelineId));
    }

    private static String feedback(int iteration, Decision decision) {
        var sb = new StringBuilder("Iteration ").append(iteration).append(' ')
                .append(decision.type().wireName());
        if (!decision.reasoning().isBlank()) {
            sb.append(": ").append(decision.reasoning());
        }
        if (!decision.issues().isEmpty()) {
            sb.append("; issues: ").append(String.join("; ", decision.issues()));
        }
        if (!decision.suggestions().isEmpty()) {
            sb.append("; suggestions: ").append(String.join("; ", decision.suggestions()));
        }
        return sb.toString();
    }

    private static List<String> stringList(JsonNode node) {
        var values = new ArrayList<String>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }

    /**
     * Generates a pipeline id in the format PIPE-YYYY-NNNN.
     */
    String generatePipelineId() {
        int count = pipelineCounter.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PIPE-%d-%04d", year, count);
    }

    private enum Stage { PLAN, BUILD, VERIFY }

    /** Per-run bookkeeping that never leaves the driving thread. */
    private static final class RunContext {
        private final String pipelineId;
        private String lastWorkerId;
        private PromptTemplates.PreviousAttempt previousAttempt;

        private RunContext(String pipelineId) {
            this.pipelineId = pipelineId;
        }
    }
}
