package com.fleetmind.dispatch.cli;

import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStatus;
import com.fleetmind.core.persistence.RunStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CLI command: fleetmind runs
 * <p>
 * Lists stored worker runs, most recent first, as a table:
 * Worker | Status | Source | Started | Pipeline | Prompt (truncated).
 */
@Command(name = "runs", mixinStandardHelpOptions = true, description = "List worker run history")
@Component
public class RunsCommand implements Runnable {

    private static final DateTimeFormatter STARTED =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    @Option(names = {"--status", "-s"},
            description = "Only runs in this status: running, completed, stopped, crashed, waiting_input")
    private String status;

    @Option(names = {"--resumable", "-r"}, description = "Only crashed runs that can be resumed")
    private boolean resumable;

    private final RunStore runStore;

    public RunsCommand(RunStore runStore) {
        this.runStore = runStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunRecord> runs;
        if (resumable) {
            runs = runStore.getResumableRuns().stream().limit(limit).toList();
        } else {
            RunQuery query = RunQuery.all().withLimit(limit);
            if (status != null) {
                RunStatus filter = parseStatus(status);
                if (filter == null) {
                    ConsoleOutput.error("Unknown status: " + status);
                    return;
                }
                query = RunQuery.byStatus(filter).withLimit(limit);
            }
            runs = runStore.queryRuns(query);
        }

        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-10s %-14s %-9s %-17s %-15s %s%n",
                "WORKER", "STATUS", "SOURCE", "STARTED", "PIPELINE", "PROMPT");
        System.out.println("  " + "-".repeat(96));

        for (RunRecord run : runs) {
            System.out.printf("  %-10s %-14s %-9s %-17s %-15s %s%n",
                    ConsoleOutput.shortId(run.getWorkerId()),
                    run.getStatus().wireName(),
                    run.getSource() != null ? run.getSource().wireName() : "-",
                    run.getStartedAt() != null ? STARTED.format(run.getStartedAt()) : "-",
                    run.getPipelineId() != null ? run.getPipelineId() : "-",
                    ConsoleOutput.truncate(run.getInitialPrompt(), 30));
        }
    }

    private static RunStatus parseStatus(String name) {
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (RunStatus candidate : RunStatus.values()) {
            if (candidate.wireName().equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
