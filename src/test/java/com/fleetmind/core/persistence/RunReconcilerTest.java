package com.fleetmind.core.persistence;

import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStatus;
import com.fleetmind.core.model.WorkerSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RunReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final InMemoryRunStore store = new InMemoryRunStore();
    private final RunReconciler reconciler = new RunReconciler(store, Clock.fixed(NOW, ZoneOffset.UTC));

    private void save(String workerId, RunStatus status) {
        var run = RunRecord.started(workerId, "/work", WorkerSource.CLI, null, NOW.minusSeconds(600));
        run.setStatus(status);
        store.createRun(run);
    }

    @Test
    @DisplayName("orphaned live runs become resumable crashes")
    void marksOrphansCrashed() {
        save("w-running", RunStatus.RUNNING);
        save("w-waiting", RunStatus.WAITING_INPUT);
        save("w-done", RunStatus.COMPLETED);

        assertEquals(2, reconciler.reconcile());

        for (String id : List.of("w-running", "w-waiting")) {
            RunRecord run = store.getRun(id).orElseThrow();
            assertEquals(RunStatus.CRASHED, run.getStatus());
            assertTrue(run.isCanResume());
            assertEquals(NOW, run.getEndedAt());
            assertEquals(RunReconciler.ORPHAN_ERROR, run.getErrorMessage());
        }
        assertEquals(RunStatus.COMPLETED, store.getRun("w-done").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("an existing error message is kept")
    void keepsErrorMessage() {
        var run = RunRecord.started("w-1", "/work", WorkerSource.CLI, null, NOW);
        run.setErrorMessage("stderr: out of memory");
        store.createRun(run);

        reconciler.reconcile();

        assertEquals("stderr: out of memory", store.getRun("w-1").orElseThrow().getErrorMessage());
    }

    @Test
    @DisplayName("a second pass finds nothing")
    void idempotent() {
        save("w-1", RunStatus.RUNNING);
        reconciler.reconcile();
        assertEquals(0, reconciler.reconcile());
    }

    @Test
    @DisplayName("store failure stops reconciliation without throwing")
    void storeFailure() {
        RunStore failing = mock(RunStore.class);
        when(failing.findLiveRuns()).thenThrow(new RunStoreException("database down", null));

        assertEquals(0, new RunReconciler(failing, Clock.systemUTC()).reconcile());
    }
}
