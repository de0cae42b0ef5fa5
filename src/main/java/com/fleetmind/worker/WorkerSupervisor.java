package com.fleetmind.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.events.EventBus;
import com.fleetmind.core.events.EventTypes;
import com.fleetmind.core.events.FleetEvent;
import com.fleetmind.core.metrics.FleetmindMetrics;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.WorkerStatistics;
import com.fleetmind.core.persistence.PersistenceQueue;
import com.fleetmind.core.persistence.RunStore;
import com.fleetmind.core.stream.ParseResult;
import com.fleetmind.core.stream.StreamParser;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spawns, feeds and stops worker processes and keeps their state current.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Resolves the launch through {@link LaunchRequestFactory} and starts it with {@link WorkerLauncher}</li>
 *   <li>Runs one {@link StreamConsumer} per output stream and applies every parsed line to its {@link WorkerAgent}</li>
 *   <li>Publishes output, status, statistics and input-required events on the {@link EventBus}</li>
 *   <li>Writes run history to the {@link RunStore} through the {@link PersistenceQueue}</li>
 * </ul>
 */
@Service
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final LaunchRequestFactory launchRequests;
    private final WorkerLauncher launcher;
    private final StreamParser parser;
    private final RunStore runStore;
    private final PersistenceQueue persistence;
    private final EventBus eventBus;
    private final FleetmindMetrics metrics;
    private final ObjectMapper objectMapper;
    private final OutputHistory history;
    private final WorkerRegistry registry;
    private final Duration stopGrace;
    private final ExecutorService streamExecutor;

    public WorkerSupervisor(LaunchRequestFactory launchRequests, WorkerLauncher launcher, StreamParser parser,
                            RunStore runStore, PersistenceQueue persistence, EventBus eventBus,
                            FleetmindMetrics metrics, ObjectMapper objectMapper, FleetmindProperties properties) {
        this.launchRequests = launchRequests;
        this.launcher = launcher;
        this.parser = parser;
        this.runStore = runStore;
        this.persistence = persistence;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        var workerProps = properties.getWorker();
        this.history = new OutputHistory(workerProps.getRecentOutputLimit());
        this.registry = new WorkerRegistry(workerProps.getRetainedEndedWorkers());
        this.stopGrace = Duration.ofMillis(workerProps.getStopGraceMillis());
        this.streamExecutor = Executors.newCachedThreadPool(streamThreads());
    }

    /**
     * Starts a worker process and begins consuming its output.
     *
     * @return the new worker's id
     * @throws SpawnException when the executable cannot be located or started
     */
    public String spawn(SpawnRequest request) throws SpawnException {
        String workerId = UUID.randomUUID().toString();
        WorkerProcess process;
        try {
            process = launcher.launch(launchRequests.create(workerId, request));
        } catch (IOException e) {
            metrics.recordSpawnFailure();
            throw new SpawnException("Failed to start worker in " + request.workingDir() + ": " + e.getMessage(), e);
        } catch (SpawnException e) {
            metrics.recordSpawnFailure();
            throw e;
        }

        var agent = new WorkerAgent(workerId, request, process, Instant.now());
        registry.add(agent);
        RunRecord run = agent.runCopy();
        persistence.submit("create run " + workerId, () -> runStore.createRun(run));

        try {
            streamExecutor.execute(new StreamConsumer(agent, "stdout", process.stdout(),
                    line -> handleStdoutLine(agent, line), () -> finalizeWorker(agent)));
            streamExecutor.execute(new StreamConsumer(agent, "stderr", process.stderr(),
                    line -> handleStderrLine(agent, line), () -> {}));
        } catch (RejectedExecutionException e) {
            process.destroy(stopGrace);
            finalizeWorker(agent);
            throw new SpawnException("Supervisor is shutting down", e);
        }

        metrics.recordWorkerSpawned(request.source().wireName());
        publishStatus(agent);
        log.info("Spawned worker {} (pid {}) in {}", workerId, process.pid(), request.workingDir());
        return workerId;
    }

    /**
     * Stops a worker and finalizes its run. Unknown or already stopped workers are ignored.
     */
    public void stop(String workerId) {
        Optional<WorkerAgent> found = registry.live(workerId);
        if (found.isEmpty()) {
            log.debug("Stop requested for worker {} which is not live", workerId);
            return;
        }
        WorkerAgent agent = found.get();
        if (!agent.markStopping()) {
            return;
        }
        publishStatus(agent);
        agent.process().destroy(stopGrace);
        finalizeWorker(agent);
        log.info("Stopped worker {}", workerId);
    }

    public void stopAll(Collection<String> workerIds) {
        for (String workerId : workerIds) {
            stop(workerId);
        }
    }

    /**
     * Sends a prompt to a worker as one stream-json user message.
     *
     * @throws WorkerNotLiveException when the worker is not live or its stdin is closed
     */
    public void sendInput(String workerId, String text) {
        WorkerAgent agent = registry.live(workerId).orElseThrow(() -> new WorkerNotLiveException(workerId));
        Instant now = Instant.now();
        RunRecord run = agent.beginTurn(text, now);
        try {
            agent.writeLine(userMessage(text));
        } catch (IOException e) {
            throw new WorkerNotLiveException(workerId, e);
        }
        persistence.submit("record prompt " + workerId, () -> runStore.recordPrompt(workerId, text, now));
        persistence.submit("update run " + workerId, () -> runStore.updateRun(run));
        publishStatus(agent);
        log.debug("Sent {} chars of input to worker {}", text.length(), workerId);
    }

    public Optional<WorkerStatistics.Snapshot> getStatistics(String workerId) {
        return registry.find(workerId).map(WorkerAgent::statistics);
    }

    public List<WorkerSnapshot> list() {
        var snapshots = new ArrayList<WorkerSnapshot>();
        for (WorkerAgent agent : registry.liveAgents()) {
            snapshots.add(agent.snapshot());
        }
        return snapshots;
    }

    public Optional<WorkerSnapshot> get(String workerId) {
        return registry.find(workerId).map(WorkerAgent::snapshot);
    }

    public Optional<String> findBySession(String sessionId) {
        return registry.findBySession(sessionId);
    }

    /**
     * Recent output of a worker, oldest first. Falls back to the run store once the
     * in-memory history of an ended worker has been dropped.
     */
    public List<OutputEvent> recentOutput(String workerId, int limit) {
        List<OutputEvent> recent = history.recent(workerId, limit);
        if (!recent.isEmpty() || registry.find(workerId).isPresent()) {
            return recent;
        }
        return runStore.getOutputs(workerId, limit);
    }

    /**
     * Waits until the worker waits for input, is stopped or has failed.
     *
     * @return the worker's snapshot once settled, or empty when the timeout elapsed
     * @throws WorkerNotLiveException when the worker is unknown
     */
    public Optional<WorkerSnapshot> awaitSettled(String workerId, Duration timeout) throws InterruptedException {
        WorkerAgent agent = registry.find(workerId).orElseThrow(() -> new WorkerNotLiveException(workerId));
        return agent.awaitSettled(timeout) ? Optional.of(agent.snapshot()) : Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        List<String> live = registry.liveIds();
        if (!live.isEmpty()) {
            log.info("Stopping {} live workers", live.size());
        }
        stopAll(live);
        streamExecutor.shutdown();
        try {
            if (!streamExecutor.awaitTermination(stopGrace.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                streamExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            streamExecutor.shutdownNow();
        }
    }

    private void handleStdoutLine(WorkerAgent agent, String line) {
        ParseResult result = parser.parse(agent.id(), line);
        // History first: a waiter woken by the status change reads it straight away.
        for (OutputEvent event : result.events()) {
            history.append(event);
        }
        WorkerAgent.LineOutcome outcome = agent.apply(result, Instant.now());

        for (OutputEvent event : result.events()) {
            publishOutput(agent, event);
        }
        if (outcome.newSessionId() != null) {
            registry.registerSession(outcome.newSessionId(), agent.id());
            log.debug("Worker {} reported session {}", agent.id(), outcome.newSessionId());
        }
        if (outcome.statistics() != null) {
            eventBus.publish(FleetEvent.forWorker(EventTypes.WORKER_STATS, agent.pipelineId(), agent.id(),
                    Map.of("statistics", outcome.statistics())));
        }
        if (outcome.run() != null) {
            RunRecord run = outcome.run();
            persistence.submit("update run " + agent.id(), () -> runStore.updateRun(run));
        }
        if (outcome.statusChanged()) {
            publishStatus(agent);
        }
        if (outcome.inputRequired()) {
            eventBus.publish(FleetEvent.forWorker(EventTypes.WORKER_INPUT_REQUIRED, agent.pipelineId(), agent.id(),
                    Map.of("lastOutput", outcome.lastText() != null ? outcome.lastText() : "")));
        }
    }

    private void handleStderrLine(WorkerAgent agent, String line) {
        OutputEvent event = OutputEvent.of(agent.id(), OutputType.ERROR, line, null,
                OutputEvent.MessageHeader.EMPTY, Instant.now());
        history.append(event);
        agent.recordOutput(event.byteSize(), event.timestamp());
        publishOutput(agent, event);
    }

    private void publishOutput(WorkerAgent agent, OutputEvent event) {
        metrics.recordOutputEvent(event.outputType().wireName());
        eventBus.publish(FleetEvent.forWorker(EventTypes.WORKER_OUTPUT, agent.pipelineId(), agent.id(),
                Map.of("output", event)));
        persistence.submit("record output " + agent.id(), () -> runStore.recordOutput(event));
    }

    private void finalizeWorker(WorkerAgent agent) {
        Optional<RunRecord> finished = agent.finish(Instant.now());
        if (finished.isEmpty()) {
            return;
        }
        RunRecord run = finished.get();
        registry.retire(agent.id()).forEach(history::forget);
        persistence.submit("finalize run " + agent.id(), () -> runStore.updateRun(run));
        metrics.recordWorkerEnded(run.getStatus().wireName());
        publishStatus(agent);
        if (run.getErrorMessage() != null) {
            log.warn("Worker {} ended as {}: {}", agent.id(), run.getStatus().wireName(), run.getErrorMessage());
        } else {
            log.info("Worker {} ended as {}", agent.id(), run.getStatus().wireName());
        }
    }

    private void publishStatus(WorkerAgent agent) {
        eventBus.publish(FleetEvent.forWorker(EventTypes.WORKER_STATUS, agent.pipelineId(), agent.id(),
                Map.of("status", agent.status().wireName())));
    }

    String userMessage(String text) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "user");
        ObjectNode body = message.putObject("message");
        body.put("role", "user");
        ObjectNode block = body.putArray("content").addObject();
        block.put("type", "text");
        block.put("text", text);
        return message.toString();
    }

    private static ThreadFactory streamThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "fleetmind-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
