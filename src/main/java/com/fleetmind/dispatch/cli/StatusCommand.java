package com.fleetmind.dispatch.cli;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.PromptRecord;
import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.persistence.RunStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CLI command: fleetmind status &lt;worker-id&gt;
 * <p>
 * Shows the stored run of one worker: status, timings, statistics, prompts and
 * the tail of its output.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the run of one worker")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Worker ID (a unique prefix is accepted)")
    private String workerId;

    @Option(names = {"--tail", "-t"}, description = "Number of output events to show", defaultValue = "10")
    private int tail;

    private final RunStore runStore;

    public StatusCommand(RunStore runStore) {
        this.runStore = runStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<RunRecord> found = resolve(workerId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Run not found: " + workerId);
            return;
        }
        RunRecord run = found.get();

        System.out.println("WORKER " + run.getWorkerId());
        System.out.println("  Status:      " + ConsoleOutput.statusLabel(run.getStatus())
                + (run.isCanResume() ? " (resumable)" : ""));
        System.out.println("  Directory:   " + run.getWorkingDir());
        System.out.println("  Source:      " + (run.getSource() != null ? run.getSource().wireName() : "-"));
        if (run.getPipelineId() != null) {
            System.out.println("  Pipeline:    " + run.getPipelineId());
        }
        if (run.getSessionId() != null) {
            System.out.println("  Session:     " + run.getSessionId());
        }
        System.out.println("  Started:     " + run.getStartedAt());
        if (run.getEndedAt() != null) {
            System.out.println("  Ended:       " + run.getEndedAt() + " (" + ConsoleOutput.formatDuration(
                    run.getEndedAt().toEpochMilli() - run.getStartedAt().toEpochMilli()) + ")");
        }
        System.out.println("  Prompts:     " + run.getTotalPrompts());
        System.out.println("  Tool calls:  " + run.getTotalToolCalls());
        System.out.println("  Output:      " + run.getTotalOutputBytes() + " bytes");
        if (run.getTotalTokensUsed() != null) {
            System.out.println("  Tokens:      " + run.getTotalTokensUsed());
        }
        if (run.getTotalCostUsd() != null) {
            System.out.println("  Cost:        " + String.format(Locale.ROOT, "$%.4f", run.getTotalCostUsd()));
        }
        if (run.getErrorMessage() != null) {
            ConsoleOutput.error(run.getErrorMessage());
        }

        List<PromptRecord> prompts = runStore.getPrompts(run.getWorkerId());
        if (!prompts.isEmpty()) {
            System.out.println();
            System.out.println("PROMPTS:");
            for (PromptRecord prompt : prompts) {
                System.out.println("  " + prompt.timestamp() + "  " + ConsoleOutput.truncate(prompt.prompt(), 80));
            }
        }

        List<OutputEvent> outputs = runStore.getOutputs(run.getWorkerId(), tail);
        if (!outputs.isEmpty()) {
            System.out.println();
            System.out.println("OUTPUT (last " + outputs.size() + "):");
            for (OutputEvent output : outputs) {
                System.out.printf("  %-12s %s%n", output.outputType().wireName(),
                        ConsoleOutput.truncate(output.content().replace('\n', ' '), 100));
            }
        }
    }

    private Optional<RunRecord> resolve(String id) {
        Optional<RunRecord> exact = runStore.getRun(id);
        if (exact.isPresent()) {
            return exact;
        }
        List<RunRecord> matches = runStore.queryRuns(RunQuery.all()).stream()
                .filter(r -> r.getWorkerId().startsWith(id))
                .toList();
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }
}
