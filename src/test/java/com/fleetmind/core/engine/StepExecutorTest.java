package com.fleetmind.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.StepOutput;
import com.fleetmind.core.model.StepRole;
import com.fleetmind.core.model.WorkerSource;
import com.fleetmind.core.model.WorkerStatus;
import com.fleetmind.worker.SpawnException;
import com.fleetmind.worker.SpawnRequest;
import com.fleetmind.worker.WorkerNotLiveException;
import com.fleetmind.worker.WorkerSnapshot;
import com.fleetmind.worker.WorkerSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StepExecutorTest {

    private WorkerSupervisor supervisor;
    private StepExecutor executor;

    @BeforeEach
    void setUp() {
        supervisor = mock(WorkerSupervisor.class);
        var properties = new FleetmindProperties();
        properties.getWorker().setSettleTimeoutSeconds(3);
        executor = new StepExecutor(supervisor, new OutputExtractor(new ObjectMapper()), properties);
    }

    private static WorkerSnapshot snapshot(WorkerStatus status) {
        return snapshot(status, false);
    }

    private static WorkerSnapshot snapshot(WorkerStatus status, boolean turnFailed) {
        return new WorkerSnapshot("w-1", Path.of("/work"), status, "sess", false, false, turnFailed, Instant.now(),
                "PIPE-2026-0001", WorkerSource.PIPELINE, "done", null, 42L, null);
    }

    private static OutputEvent output(OutputType type, String content) {
        return OutputEvent.of("w-1", type, content, null, OutputEvent.MessageHeader.EMPTY, Instant.now());
    }

    @Test
    @DisplayName("spawn passes the pipeline's directory, model and id")
    void spawnBuildsRequest() throws Exception {
        when(supervisor.spawn(any())).thenReturn("w-1");
        var pipeline = new Pipeline("PIPE-2026-0001", "task", "/work/app", "sonnet", 3, Instant.now());

        assertEquals("w-1", executor.spawn(pipeline, StepRole.PLANNING));

        var captor = ArgumentCaptor.forClass(SpawnRequest.class);
        verify(supervisor).spawn(captor.capture());
        assertEquals(Path.of("/work/app"), captor.getValue().workingDir());
        assertEquals("sonnet", captor.getValue().model());
        assertEquals(WorkerSource.PIPELINE, captor.getValue().source());
        assertEquals("PIPE-2026-0001", captor.getValue().pipelineId());
    }

    @Test
    @DisplayName("spawn failure becomes a step failure")
    void spawnFailure() throws Exception {
        when(supervisor.spawn(any())).thenThrow(new SpawnException("executable not found"));
        var pipeline = new Pipeline("PIPE-2026-0001", "task", "/work", null, 3, Instant.now());

        var e = assertThrows(StepFailedException.class, () -> executor.spawn(pipeline, StepRole.BUILDING));
        assertEquals(StepRole.BUILDING, e.getRole());
        assertTrue(e.getMessage().contains("executable not found"));
    }

    @Test
    @DisplayName("execute sends the prompt, waits, and extracts the final text")
    void executeExtractsOutput() throws Exception {
        when(supervisor.awaitSettled("w-1", Duration.ofSeconds(3)))
                .thenReturn(Optional.of(snapshot(WorkerStatus.WAITING_FOR_INPUT)));
        when(supervisor.recentOutput("w-1", StepExecutor.OUTPUT_WINDOW)).thenReturn(List.of(
                output(OutputType.TEXT, "Working on it"),
                output(OutputType.TEXT, "```json\n{\"overall_status\":\"success\"}\n```")));

        StepOutput result = executor.execute("w-1", StepRole.VERIFYING, "verify this");

        verify(supervisor).sendInput("w-1", "verify this");
        assertTrue(result.structured().isPresent());
        assertEquals("success", result.structuredData().get("overall_status").asText());
    }

    @Test
    @DisplayName("a stopped worker still yields its output")
    void stoppedWorkerIsAccepted() throws Exception {
        when(supervisor.awaitSettled(any(), any())).thenReturn(Optional.of(snapshot(WorkerStatus.STOPPED)));
        when(supervisor.recentOutput(any(), anyInt())).thenReturn(List.of(output(OutputType.TEXT, "Plan text")));

        assertEquals("Plan text", executor.execute("w-1", StepRole.PLANNING, "plan").rawText());
    }

    @Test
    @DisplayName("worker in error fails the step")
    void errorWorkerFails() throws Exception {
        when(supervisor.awaitSettled(any(), any())).thenReturn(Optional.of(snapshot(WorkerStatus.ERROR)));

        var e = assertThrows(StepFailedException.class, () -> executor.execute("w-1", StepRole.BUILDING, "build"));
        assertEquals("The building worker terminated unexpectedly", e.getMessage());
        verify(supervisor, never()).recentOutput(any(), anyInt());
    }

    @Test
    @DisplayName("failed turn fails the step without reading output")
    void failedTurnFails() throws Exception {
        when(supervisor.awaitSettled(any(), any()))
                .thenReturn(Optional.of(snapshot(WorkerStatus.PROCESSING, true)));

        var e = assertThrows(StepFailedException.class, () -> executor.execute("w-1", StepRole.VERIFYING, "verify"));
        assertEquals("The verifying worker reported a failed turn", e.getMessage());
        verify(supervisor, never()).recentOutput(any(), anyInt());
    }

    @Test
    @DisplayName("timeout fails the step")
    void timeoutFails() throws Exception {
        when(supervisor.awaitSettled(any(), any())).thenReturn(Optional.empty());

        var e = assertThrows(StepFailedException.class, () -> executor.execute("w-1", StepRole.BUILDING, "build"));
        assertTrue(e.getMessage().contains("did not finish within 3s"));
    }

    @Test
    @DisplayName("worker gone before the prompt fails the step")
    void deadWorkerFails() {
        doThrow(new WorkerNotLiveException("w-1")).when(supervisor).sendInput("w-1", "plan");

        var e = assertThrows(StepFailedException.class, () -> executor.execute("w-1", StepRole.PLANNING, "plan"));
        assertInstanceOf(WorkerNotLiveException.class, e.getCause());
    }
}
