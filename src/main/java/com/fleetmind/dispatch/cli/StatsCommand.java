package com.fleetmind.dispatch.cli;

import com.fleetmind.core.model.RunStats;
import com.fleetmind.core.persistence.RunStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;
import java.util.Map;

/**
 * CLI command: fleetmind stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show aggregate run statistics")
@Component
public class StatsCommand implements Runnable {

    private final RunStore runStore;

    public StatsCommand(RunStore runStore) {
        this.runStore = runStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        RunStats stats = runStore.getStats();
        ConsoleOutput.info("Total runs: " + stats.totalRuns());
        printCounts("By status", stats.byStatus());
        printCounts("By source", stats.bySource());
        System.out.println();
        System.out.println("  Total cost:     " + String.format(Locale.ROOT, "$%.4f", stats.totalCostUsd()));
        System.out.println("  Resumable runs: " + stats.resumableRuns());
    }

    private static void printCounts(String title, Map<String, Long> counts) {
        if (counts.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println("  " + title + ":");
        counts.forEach((name, count) -> System.out.printf("    %-14s %d%n", name, count));
    }
}
