package com.fleetmind.dispatch.cli;

import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.engine.PipelineOrchestrator;
import com.fleetmind.core.events.EventBus;
import com.fleetmind.core.events.EventTypes;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind run "&lt;request&gt;"
 * <p>
 * Submits a request as a new pipeline and drives it through plan, build and verify
 * in the foreground, printing state changes, step progress and decisions as they happen.
 * Exits 0 when the pipeline completes, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a plan/build/verify pipeline")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request for the workers")
    private String request;

    @Option(names = {"--dir", "-d"}, description = "Working directory for the workers", defaultValue = ".")
    private Path dir;

    @Option(names = {"--max-iterations", "-i"},
            description = "Iteration budget, 0 for unbounded (default: configured value)")
    private Integer maxIterations;

    @Option(names = {"--model", "-m"}, description = "Model passed to every worker")
    private String model;

    @Option(names = {"--show-output", "-o"}, description = "Print worker output as it streams")
    private boolean showOutput;

    private final PipelineOrchestrator orchestrator;
    private final EventBus eventBus;
    private final FleetmindProperties properties;

    public RunCommand(PipelineOrchestrator orchestrator, EventBus eventBus, FleetmindProperties properties) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path workingDir = dir.toAbsolutePath().normalize();
        if (!Files.isDirectory(workingDir)) {
            ConsoleOutput.error("Not a directory: " + workingDir);
            return 2;
        }
        int budget = maxIterations != null ? maxIterations : properties.getPipeline().getMaxIterations();
        if (budget < 0) {
            ConsoleOutput.error("--max-iterations must be 0 or greater");
            return 2;
        }

        Pipeline submitted;
        try {
            submitted = orchestrator.submit(request, workingDir.toString(), budget, model);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Pipeline " + submitted.getId() + " in " + workingDir);

        EventBus.Subscription subscription = eventBus.subscribe(submitted.getId(), event -> {
            boolean workerOutput = EventTypes.WORKER_OUTPUT.equals(event.eventType());
            if (!workerOutput || showOutput) {
                ConsoleOutput.event(event);
            }
        });
        Pipeline finished;
        try {
            finished = orchestrator.run(submitted.getId());
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.pipelineSummary(finished);
        System.out.println();
        if (finished.getState() == PipelineState.COMPLETED) {
            ConsoleOutput.success("Pipeline complete.");
            return 0;
        }
        ConsoleOutput.error("Pipeline ended as " + finished.getState().displayName() + ".");
        return 1;
    }
}
