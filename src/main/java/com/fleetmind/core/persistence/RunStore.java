package com.fleetmind.core.persistence;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.PromptRecord;
import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStats;
import com.fleetmind.core.model.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable history of worker runs, keyed by worker id.
 * <p>
 * Write operations throw {@link RunStoreException} on failure. Callers on the
 * streaming path go through {@link PersistenceQueue}, which absorbs those failures.
 */
public interface RunStore {

    /**
     * Stores a new run.
     *
     * @return the generated row id
     */
    long createRun(RunRecord run);

    /** Replaces the stored run with the same worker id. */
    void updateRun(RunRecord run);

    Optional<RunRecord> getRun(String workerId);

    /** Runs matching the query, most recently started first. */
    List<RunRecord> queryRuns(RunQuery query);

    /** Runs left in RUNNING or WAITING_INPUT. */
    default List<RunRecord> findLiveRuns() {
        var live = new ArrayList<>(queryRuns(RunQuery.byStatus(RunStatus.RUNNING)));
        live.addAll(queryRuns(RunQuery.byStatus(RunStatus.WAITING_INPUT)));
        return live;
    }

    /** Crashed runs that can be restarted. */
    default List<RunRecord> getResumableRuns() {
        return queryRuns(RunQuery.byStatus(RunStatus.CRASHED)).stream()
                .filter(RunRecord::isCanResume)
                .toList();
    }

    void recordPrompt(String workerId, String prompt, Instant at);

    List<PromptRecord> getPrompts(String workerId);

    void recordOutput(OutputEvent event);

    /** The most recent {@code limit} outputs of a worker, oldest first. */
    List<OutputEvent> getOutputs(String workerId, int limit);

    /**
     * Deletes finished runs (and their prompts and outputs) started before the cutoff.
     *
     * @return number of runs deleted
     */
    int cleanupRunsBefore(Instant cutoff);

    RunStats getStats();
}
