package com.fleetmind.core.persistence;

import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Marks runs orphaned by an ungraceful shutdown as crashed.
 * <p>
 * Runs once at application startup, before any command executes: every stored run
 * still RUNNING or WAITING_INPUT belongs to a process that no longer exists.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RunReconciler implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RunReconciler.class);

    static final String ORPHAN_ERROR = "Process terminated unexpectedly (app restart)";

    private final RunStore runStore;
    private final Clock clock;

    @Autowired
    public RunReconciler(RunStore runStore) {
        this(runStore, Clock.systemUTC());
    }

    RunReconciler(RunStore runStore, Clock clock) {
        this.runStore = runStore;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        reconcile();
    }

    /**
     * @return number of runs marked crashed
     */
    public int reconcile() {
        int reconciled = 0;
        Instant now = clock.instant();
        try {
            for (RunRecord run : runStore.findLiveRuns()) {
                run.setStatus(RunStatus.CRASHED);
                run.setCanResume(true);
                run.setEndedAt(now);
                run.setLastActivity(now);
                if (run.getErrorMessage() == null) {
                    run.setErrorMessage(ORPHAN_ERROR);
                }
                runStore.updateRun(run);
                reconciled++;
            }
        } catch (RunStoreException e) {
            log.error("Run reconciliation stopped after {} runs: {}", reconciled, e.getMessage(), e);
            return reconciled;
        }
        if (reconciled > 0) {
            log.info("Marked {} orphaned runs as crashed", reconciled);
        }
        return reconciled;
    }
}
