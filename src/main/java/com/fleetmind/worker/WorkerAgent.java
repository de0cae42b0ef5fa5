package com.fleetmind.worker;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStatus;
import com.fleetmind.core.model.WorkerSource;
import com.fleetmind.core.model.WorkerStatistics;
import com.fleetmind.core.model.WorkerStatus;
import com.fleetmind.core.stream.ParseResult;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One supervised worker: its process, status flags, statistics and run record.
 * <p>
 * All state is guarded by a single lock that is never held across process I/O.
 * Writes to stdin are serialized on a separate monitor so prompt lines never interleave.
 */
public class WorkerAgent {

    static final String CRASH_MESSAGE = "Process terminated unexpectedly";

    private final String id;
    private final Path workingDir;
    private final String pipelineId;
    private final WorkerSource source;
    private final String model;
    private final WorkerProcess process;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition statusChanged = lock.newCondition();
    private final Object stdinMonitor = new Object();

    private final WorkerStatistics statistics;
    private final RunRecord run;
    private WorkerStatus status = WorkerStatus.IDLE;
    private String sessionId;
    private boolean processing;
    private boolean pendingInput;
    private boolean turnFailed;
    private String lastText;
    private boolean finalized;

    WorkerAgent(String id, SpawnRequest request, WorkerProcess process, Instant startedAt) {
        this.id = id;
        this.workingDir = request.workingDir();
        this.pipelineId = request.pipelineId();
        this.source = request.source();
        this.model = request.model();
        this.process = process;
        this.statistics = new WorkerStatistics(startedAt);
        this.run = RunRecord.started(id, workingDir.toString(), source, pipelineId, startedAt);
    }

    public String id() {
        return id;
    }

    public String pipelineId() {
        return pipelineId;
    }

    WorkerProcess process() {
        return process;
    }

    /**
     * Applies one parsed stdout line to the worker's counters and status.
     */
    LineOutcome apply(ParseResult result, Instant at) {
        lock.lock();
        try {
            for (OutputEvent event : result.events()) {
                statistics.recordOutput(event.byteSize(), at);
            }
            statistics.recordToolCalls(result.toolCalls(), at);

            String newSession = null;
            if (result.sessionId() != null && !result.sessionId().equals(sessionId)) {
                sessionId = result.sessionId();
                run.setSessionId(sessionId);
                newSession = sessionId;
            }

            WorkerStatistics.Snapshot stats = null;
            if (result.usage() != null) {
                statistics.merge(result.usage(), at);
                stats = statistics.snapshot();
                run.applyStatistics(stats);
            }
            if (result.lastText() != null) {
                lastText = result.lastText();
            }

            WorkerStatus before = status;
            RunStatus runBefore = run.getStatus();
            boolean inputRequired = false;
            boolean failedNow = false;
            if (!finalized && status != WorkerStatus.STOPPED) {
                switch (result.signal()) {
                    case TOOL_INVOKED, CONTINUING -> {
                        processing = true;
                        pendingInput = false;
                        status = WorkerStatus.PROCESSING;
                    }
                    case TURN_ENDED, TURN_SUCCEEDED -> {
                        processing = false;
                        pendingInput = true;
                        turnFailed = false;
                        status = WorkerStatus.WAITING_FOR_INPUT;
                        run.setStatus(RunStatus.WAITING_INPUT);
                        inputRequired = true;
                    }
                    // Flags stay as they are; only waiters are told the turn is over.
                    case TURN_FAILED -> {
                        failedNow = !turnFailed;
                        turnFailed = true;
                    }
                    case NONE -> {
                    }
                }
            }
            run.setLastActivity(at);
            if (status != before || failedNow) {
                statusChanged.signalAll();
            }

            boolean runChanged = newSession != null || stats != null || run.getStatus() != runBefore;
            return new LineOutcome(newSession, status != before, status, inputRequired,
                    lastText != null ? lastText : "", stats, runChanged ? run.copy() : null);
        } finally {
            lock.unlock();
        }
    }

    void recordOutput(long bytes, Instant at) {
        lock.lock();
        try {
            statistics.recordOutput(bytes, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the start of a new turn driven by {@code prompt}.
     *
     * @return the run record after the update
     * @throws WorkerNotLiveException when the worker has ended or is being stopped
     */
    RunRecord beginTurn(String prompt, Instant at) {
        lock.lock();
        try {
            if (finalized || status == WorkerStatus.STOPPED || status == WorkerStatus.ERROR) {
                throw new WorkerNotLiveException(id);
            }
            pendingInput = false;
            processing = true;
            turnFailed = false;
            status = WorkerStatus.PROCESSING;
            statistics.recordPrompt(at);
            if (run.getInitialPrompt() == null) {
                run.setInitialPrompt(prompt);
            }
            run.setStatus(RunStatus.RUNNING);
            run.applyStatistics(statistics.snapshot());
            statusChanged.signalAll();
            return run.copy();
        } finally {
            lock.unlock();
        }
    }

    void writeLine(String line) throws IOException {
        synchronized (stdinMonitor) {
            OutputStream stdin = process.stdin();
            stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }
    }

    /**
     * Moves the worker to STOPPED ahead of killing its process.
     *
     * @return false when the worker already ended or is already stopping
     */
    boolean markStopping() {
        lock.lock();
        try {
            if (finalized || status == WorkerStatus.STOPPED) {
                return false;
            }
            status = WorkerStatus.STOPPED;
            processing = false;
            pendingInput = false;
            statusChanged.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalizes the run record once the process is gone. Only the first call has an effect.
     *
     * @return the final run record, or empty when already finalized
     */
    Optional<RunRecord> finish(Instant at) {
        lock.lock();
        try {
            if (finalized) {
                return Optional.empty();
            }
            finalized = true;
            processing = false;
            pendingInput = false;
            if (status == WorkerStatus.STOPPED) {
                run.setStatus(RunStatus.STOPPED);
            } else {
                status = WorkerStatus.ERROR;
                run.setStatus(RunStatus.CRASHED);
                run.setCanResume(true);
                if (run.getErrorMessage() == null) {
                    run.setErrorMessage(CRASH_MESSAGE);
                }
            }
            run.applyStatistics(statistics.snapshot());
            run.setEndedAt(at);
            statusChanged.signalAll();
            return Optional.of(run.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the worker waits for input, is stopped, has failed, or reported a failed turn.
     *
     * @return false when the timeout elapsed first
     */
    boolean awaitSettled(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!status.isSettled() && !turnFailed) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = statusChanged.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    WorkerStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    WorkerStatistics.Snapshot statistics() {
        lock.lock();
        try {
            return statistics.snapshot();
        } finally {
            lock.unlock();
        }
    }

    RunRecord runCopy() {
        lock.lock();
        try {
            return run.copy();
        } finally {
            lock.unlock();
        }
    }

    public WorkerSnapshot snapshot() {
        lock.lock();
        try {
            return new WorkerSnapshot(id, workingDir, status, sessionId, processing, pendingInput, turnFailed,
                    statistics.lastActivity(), pipelineId, source, lastText, model, process.pid(),
                    statistics.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * What changed when a line was applied.
     *
     * @param newSessionId  session id first seen on this line (nullable)
     * @param statusChanged whether the worker status moved
     * @param status        status after the line
     * @param inputRequired whether the line ended the worker's turn
     * @param lastText      last captured text, never null
     * @param statistics    statistics after a usage merge (nullable)
     * @param run           run record to persist (nullable when the record did not change)
     */
    record LineOutcome(
        String newSessionId,
        boolean statusChanged,
        WorkerStatus status,
        boolean inputRequired,
        String lastText,
        WorkerStatistics.Snapshot statistics,
        RunRecord run
    ) {}
}
