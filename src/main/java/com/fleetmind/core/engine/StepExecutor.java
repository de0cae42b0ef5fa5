package com.fleetmind.core.engine;

import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.StepOutput;
import com.fleetmind.core.model.StepRole;
import com.fleetmind.core.model.WorkerSource;
import com.fleetmind.core.model.WorkerStatus;
import com.fleetmind.worker.SpawnException;
import com.fleetmind.worker.SpawnRequest;
import com.fleetmind.worker.WorkerNotLiveException;
import com.fleetmind.worker.WorkerSnapshot;
import com.fleetmind.worker.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one pipeline step on a fresh worker: spawn, prompt, wait, extract.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    /** Events read back from the worker when extracting the artifact. */
    static final int OUTPUT_WINDOW = 100;

    private final WorkerSupervisor supervisor;
    private final OutputExtractor extractor;
    private final Duration settleTimeout;

    public StepExecutor(WorkerSupervisor supervisor, OutputExtractor extractor, FleetmindProperties properties) {
        this.supervisor = supervisor;
        this.extractor = extractor;
        this.settleTimeout = Duration.ofSeconds(properties.getWorker().getSettleTimeoutSeconds());
    }

    /**
     * @return the new worker's id
     * @throws StepFailedException when the worker cannot be spawned
     */
    public String spawn(Pipeline pipeline, StepRole role) {
        var request = new SpawnRequest(Path.of(pipeline.getWorkingDir()), pipeline.getModel(),
                WorkerSource.PIPELINE, pipeline.getId());
        try {
            return supervisor.spawn(request);
        } catch (SpawnException e) {
            throw new StepFailedException(role, "Failed to spawn " + role.wireName() + " worker: " + e.getMessage(), e);
        }
    }

    /**
     * Sends the prompt and waits for the worker to finish its turn.
     *
     * @throws StepFailedException when the worker fails, ends, or does not settle in time
     */
    public StepOutput execute(String workerId, StepRole role, String prompt) {
        try {
            supervisor.sendInput(workerId, prompt);
        } catch (WorkerNotLiveException e) {
            throw new StepFailedException(role, "The " + role.wireName() + " worker exited before receiving its prompt", e);
        }

        Optional<WorkerSnapshot> settled;
        try {
            settled = supervisor.awaitSettled(workerId, settleTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepFailedException(role, "Interrupted while waiting for the " + role.wireName() + " worker", e);
        }
        if (settled.isEmpty()) {
            throw new StepFailedException(role, "The " + role.wireName() + " worker did not finish within "
                    + settleTimeout.toSeconds() + "s");
        }
        if (settled.get().status() == WorkerStatus.ERROR) {
            throw new StepFailedException(role, "The " + role.wireName() + " worker terminated unexpectedly");
        }
        if (settled.get().turnFailed()) {
            throw new StepFailedException(role, "The " + role.wireName() + " worker reported a failed turn");
        }

        StepOutput output = extractor.extract(supervisor.recentOutput(workerId, OUTPUT_WINDOW));
        log.info("{} step produced {} chars{}", role.wireName(), output.rawText().length(),
                output.structured().isPresent() ? " of structured output" : "");
        return output;
    }
}
