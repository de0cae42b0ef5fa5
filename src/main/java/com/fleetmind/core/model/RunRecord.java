package com.fleetmind.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable record of one worker's lifetime.
 * <p>
 * Mutable so the supervisor can update it in place; stores keep their own
 * copies via {@link #copy()}.
 */
public class RunRecord {

    private Long id;
    private String workerId;
    private String sessionId;
    private String workingDir;
    private WorkerSource source = WorkerSource.UI;
    private String pipelineId;
    private RunStatus status = RunStatus.RUNNING;
    private Instant startedAt;
    private Instant endedAt;
    private Instant lastActivity;
    private String initialPrompt;
    private String errorMessage;

    private long totalPrompts;
    private long totalToolCalls;
    private long totalOutputBytes;
    private Long totalTokensUsed;
    private Double totalCostUsd;
    private Map<String, ModelUsage> modelUsage = new LinkedHashMap<>();

    private boolean canResume;
    private String resumeData;

    public RunRecord() {}

    public static RunRecord started(String workerId, String workingDir, WorkerSource source,
                                    String pipelineId, Instant now) {
        var run = new RunRecord();
        run.workerId = workerId;
        run.workingDir = workingDir;
        run.source = source;
        run.pipelineId = pipelineId;
        run.status = RunStatus.RUNNING;
        run.startedAt = now;
        run.lastActivity = now;
        run.canResume = true;
        return run;
    }

    /** Copies the counters of a statistics snapshot onto this record. */
    public void applyStatistics(WorkerStatistics.Snapshot stats) {
        totalPrompts = stats.totalPrompts();
        totalToolCalls = stats.totalToolCalls();
        totalOutputBytes = stats.totalOutputBytes();
        totalTokensUsed = stats.totalTokensUsed();
        totalCostUsd = stats.totalCostUsd();
        modelUsage = new LinkedHashMap<>(stats.modelUsage());
        if (stats.lastActivity() != null) {
            lastActivity = stats.lastActivity();
        }
    }

    public RunRecord copy() {
        var c = new RunRecord();
        c.id = id;
        c.workerId = workerId;
        c.sessionId = sessionId;
        c.workingDir = workingDir;
        c.source = source;
        c.pipelineId = pipelineId;
        c.status = status;
        c.startedAt = startedAt;
        c.endedAt = endedAt;
        c.lastActivity = lastActivity;
        c.initialPrompt = initialPrompt;
        c.errorMessage = errorMessage;
        c.totalPrompts = totalPrompts;
        c.totalToolCalls = totalToolCalls;
        c.totalOutputBytes = totalOutputBytes;
        c.totalTokensUsed = totalTokensUsed;
        c.totalCostUsd = totalCostUsd;
        c.modelUsage = new LinkedHashMap<>(modelUsage);
        c.canResume = canResume;
        c.resumeData = resumeData;
        return c;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    public WorkerSource getSource() { return source; }
    public void setSource(WorkerSource source) { this.source = source; }
    public String getPipelineId() { return pipelineId; }
    public void setPipelineId(String pipelineId) { this.pipelineId = pipelineId; }
    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }
    public Instant getLastActivity() { return lastActivity; }
    public void setLastActivity(Instant lastActivity) { this.lastActivity = lastActivity; }
    public String getInitialPrompt() { return initialPrompt; }
    public void setInitialPrompt(String initialPrompt) { this.initialPrompt = initialPrompt; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public long getTotalPrompts() { return totalPrompts; }
    public void setTotalPrompts(long totalPrompts) { this.totalPrompts = totalPrompts; }
    public long getTotalToolCalls() { return totalToolCalls; }
    public void setTotalToolCalls(long totalToolCalls) { this.totalToolCalls = totalToolCalls; }
    public long getTotalOutputBytes() { return totalOutputBytes; }
    public void setTotalOutputBytes(long totalOutputBytes) { this.totalOutputBytes = totalOutputBytes; }
    public Long getTotalTokensUsed() { return totalTokensUsed; }
    public void setTotalTokensUsed(Long totalTokensUsed) { this.totalTokensUsed = totalTokensUsed; }
    public Double getTotalCostUsd() { return totalCostUsd; }
    public void setTotalCostUsd(Double totalCostUsd) { this.totalCostUsd = totalCostUsd; }
    public Map<String, ModelUsage> getModelUsage() { return modelUsage; }
    public void setModelUsage(Map<String, ModelUsage> modelUsage) {
        this.modelUsage = modelUsage != null ? new LinkedHashMap<>(modelUsage) : new LinkedHashMap<>();
    }
    public boolean isCanResume() { return canResume; }
    public void setCanResume(boolean canResume) { this.canResume = canResume; }
    public String getResumeData() { return resumeData; }
    public void setResumeData(String resumeData) { this.resumeData = resumeData; }
}
