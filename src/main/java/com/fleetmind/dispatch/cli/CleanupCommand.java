package com.fleetmind.dispatch.cli;

import com.fleetmind.core.persistence.RunStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * CLI command: fleetmind cleanup --days N
 * <p>
 * Deletes finished runs started more than N days ago, with their prompts and output.
 * Live runs are never deleted.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete old finished runs")
@Component
public class CleanupCommand implements Runnable {

    @Option(names = {"--days"}, description = "Age threshold in days (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private int days;

    private final RunStore runStore;
    private final Clock clock;

    @Autowired
    public CleanupCommand(RunStore runStore) {
        this(runStore, Clock.systemUTC());
    }

    CleanupCommand(RunStore runStore, Clock clock) {
        this.runStore = runStore;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (days < 0) {
            ConsoleOutput.error("--days must be 0 or greater");
            return;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = runStore.cleanupRunsBefore(cutoff);
        ConsoleOutput.success("Deleted " + deleted + " run" + (deleted != 1 ? "s" : "") + " started before " + cutoff);
    }
}
