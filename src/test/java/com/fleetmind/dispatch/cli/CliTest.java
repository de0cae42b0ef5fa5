package com.fleetmind.dispatch.cli;

import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.engine.PipelineOrchestrator;
import com.fleetmind.core.events.EventBus;
import com.fleetmind.core.model.DecisionType;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.PipelineState;
import com.fleetmind.core.model.PromptRecord;
import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStats;
import com.fleetmind.core.model.RunStatus;
import com.fleetmind.core.model.StateTransition;
import com.fleetmind.core.model.WorkerSource;
import com.fleetmind.core.persistence.RunStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Fleetmind CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private PipelineOrchestrator orchestrator;
    private RunStore runStore;
    private FleetmindProperties properties;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        runStore = mock(RunStore.class);
        properties = new FleetmindProperties();
        when(runStore.queryRuns(any())).thenReturn(List.of());
        when(runStore.getRun(anyString())).thenReturn(Optional.empty());
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator, new EventBus(), properties);
                }
                if (cls == RunsCommand.class) {
                    return (K) new RunsCommand(runStore);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(runStore);
                }
                if (cls == StatsCommand.class) {
                    return (K) new StatsCommand(runStore);
                }
                if (cls == CleanupCommand.class) {
                    return (K) new CleanupCommand(runStore, Clock.fixed(NOW, ZoneOffset.UTC));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FleetmindCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunRecord run(String workerId, RunStatus status) {
        var run = RunRecord.started(workerId, "/work/app", WorkerSource.PIPELINE, "PIPE-2026-0001", NOW);
        run.setStatus(status);
        run.setInitialPrompt("Plan the health endpoint");
        return run;
    }

    private static Pipeline finished(PipelineState state, String failureReason) {
        var pipeline = new Pipeline("PIPE-2026-0001", "Add a health endpoint", "/work", null, 5, NOW);
        pipeline.applyTransition(new StateTransition(PipelineState.RECEIVED_TASK, state, "done", NOW));
        pipeline.markFinished(state == PipelineState.COMPLETED ? DecisionType.COMPLETE : null,
                failureReason, NOW.plusSeconds(90));
        return pipeline;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("run", "runs", "status", "stats", "cleanup", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
            assertTrue(result.output().contains("plan/build/verify"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Fleetmind 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows run options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--max-iterations"));
            assertTrue(result.output().contains("--show-output"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: fleetmind"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("completed pipeline exits 0")
        void completed(@TempDir Path dir) {
            var submitted = new Pipeline("PIPE-2026-0001", "Add a health endpoint", dir.toString(), null, 3, NOW);
            when(orchestrator.submit(eq("Add a health endpoint"), anyString(), eq(3), eq("opus"))).thenReturn(submitted);
            when(orchestrator.run("PIPE-2026-0001")).thenReturn(finished(PipelineState.COMPLETED, null));

            CliResult result = execute("run", "Add a health endpoint", "--dir", dir.toString(), "-i", "3", "-m", "opus");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Pipeline PIPE-2026-0001"));
            assertTrue(result.output().contains("Pipeline complete."));
            assertTrue(result.output().contains("Duration:   1m 30s"));
        }

        @Test
        @DisplayName("failed pipeline exits 1 and shows the reason")
        void failed(@TempDir Path dir) {
            var submitted = new Pipeline("PIPE-2026-0001", "Add a health endpoint", dir.toString(), null, 5, NOW);
            when(orchestrator.submit(anyString(), anyString(), anyInt(), any())).thenReturn(submitted);
            when(orchestrator.run("PIPE-2026-0001")).thenReturn(finished(PipelineState.FAILED, "max_iterations"));

            CliResult result = execute("run", "Add a health endpoint", "--dir", dir.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("max_iterations"));
            verify(orchestrator).submit(anyString(), anyString(), eq(5), any());
        }

        @Test
        @DisplayName("missing directory and negative budget exit 2")
        void invalidArguments(@TempDir Path dir) {
            assertEquals(2, execute("run", "x", "--dir", dir.resolve("missing").toString()).exitCode());
            assertEquals(2, execute("run", "x", "--dir", dir.toString(), "-i", "-1").exitCode());
            verify(orchestrator, never()).run(anyString());
        }
    }

    @Nested
    @DisplayName("run history")
    class HistoryTests {

        @Test
        @DisplayName("runs prints a table")
        void runsTable() {
            when(runStore.queryRuns(any())).thenReturn(List.of(run("w-1", RunStatus.COMPLETED),
                    run("w-2", RunStatus.CRASHED)));

            CliResult result = execute("runs", "--limit", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Runs (2):"));
            assertTrue(result.output().contains("crashed"));
            assertTrue(result.output().contains("PIPE-2026-0001"));
            verify(runStore).queryRuns(RunQuery.all().withLimit(5));
        }

        @Test
        @DisplayName("runs filters by status and resumability")
        void runsFilters() {
            when(runStore.getResumableRuns()).thenReturn(List.of(run("w-9", RunStatus.CRASHED)));

            execute("runs", "--status", "waiting-input");
            CliResult resumable = execute("runs", "--resumable");
            CliResult unknown = execute("runs", "--status", "sleeping");

            verify(runStore).queryRuns(RunQuery.byStatus(RunStatus.WAITING_INPUT).withLimit(20));
            assertTrue(resumable.output().contains("w-9"));
            assertTrue(unknown.output().contains("Unknown status: sleeping"));
        }

        @Test
        @DisplayName("status resolves a prefix and shows prompts and output")
        void statusByPrefix() {
            var stored = run("3f2a9c1e-7b", RunStatus.COMPLETED);
            stored.setEndedAt(NOW.plusSeconds(5));
            when(runStore.queryRuns(RunQuery.all())).thenReturn(List.of(stored));
            when(runStore.getPrompts("3f2a9c1e-7b")).thenReturn(List.of(
                    new PromptRecord("3f2a9c1e-7b", "Plan the health endpoint", NOW)));
            when(runStore.getOutputs("3f2a9c1e-7b", 10)).thenReturn(List.of(
                    OutputEvent.of("3f2a9c1e-7b", OutputType.TEXT, "Plan ready", null,
                            OutputEvent.MessageHeader.EMPTY, NOW)));

            CliResult result = execute("status", "3f2a");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WORKER 3f2a9c1e-7b"));
            assertTrue(result.output().contains("PROMPTS:"));
            assertTrue(result.output().contains("Plan ready"));
        }

        @Test
        @DisplayName("status reports unknown workers")
        void statusUnknown() {
            CliResult result = execute("status", "nope");
            assertTrue(result.output().contains("Run not found: nope"));
        }

        @Test
        @DisplayName("stats prints totals")
        void stats() {
            when(runStore.getStats()).thenReturn(new RunStats(3, Map.of("completed", 2L, "crashed", 1L),
                    Map.of("pipeline", 3L), 1.5, 1));

            CliResult result = execute("stats");

            assertTrue(result.output().contains("Total runs: 3"));
            assertTrue(result.output().contains("$1.5000"));
            assertTrue(result.output().contains("Resumable runs: 1"));
        }

        @Test
        @DisplayName("cleanup deletes runs older than the threshold")
        void cleanup() {
            when(runStore.cleanupRunsBefore(NOW.minusSeconds(7 * 86400))).thenReturn(4);

            CliResult result = execute("cleanup", "--days", "7");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Deleted 4 runs"));
        }
    }
}
