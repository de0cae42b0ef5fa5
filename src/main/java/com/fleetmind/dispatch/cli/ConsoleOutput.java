package com.fleetmind.dispatch.cli;

import com.fleetmind.core.events.EventTypes;
import com.fleetmind.core.events.FleetEvent;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.RunStatus;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Fleetmind CLI.
 */
public class ConsoleOutput {

    private static final int OUTPUT_PREVIEW_CHARS = 200;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLEETMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEETMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void worker(String workerId, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [WORKER " + shortId(workerId) + "]|@ " + message));
    }

    public static void decision(String decision, String reasoning, List<?> issues) {
        String color = switch (decision) {
            case "complete" -> "fg(green)";
            case "iterate", "replan" -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + ",bold [" + decision.toUpperCase(Locale.ROOT) + "]|@ " + reasoning));
        for (Object issue : issues) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + issue));
        }
    }

    /**
     * Prints one bus event as a single line. Output events are shown as a short preview.
     */
    public static void event(FleetEvent event) {
        var payload = event.payload();
        switch (event.eventType()) {
            case EventTypes.PIPELINE_STATE_CHANGED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(cyan) [STATE]|@ " + payload.get("displayName") + " @|faint (" + payload.get("reason") + ")|@"));
            case EventTypes.PIPELINE_STEP_STATUS -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(blue) [STEP " + payload.get("step") + "]|@ " + payload.get("role") + " " + payload.get("status")));
            case EventTypes.PIPELINE_DECISION -> decision(String.valueOf(payload.get("decision")),
                    String.valueOf(payload.get("reasoning")),
                    payload.get("issues") instanceof List<?> issues ? issues : List.of());
            case EventTypes.WORKER_OUTPUT -> {
                if (payload.get("output") instanceof OutputEvent output && !output.content().isBlank()) {
                    worker(event.workerId(), output.outputType().wireName() + ": " + preview(output.content()));
                }
            }
            case EventTypes.WORKER_STATUS -> worker(event.workerId(), "status " + payload.get("status"));
            default -> {
                // worker.stats and the remaining pipeline events are summarized elsewhere
            }
        }
    }

    public static void pipelineSummary(Pipeline pipeline) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Pipeline " + pipeline.getId() + "|@"));
        System.out.println("  Request:    " + pipeline.getUserRequest());
        System.out.println("  State:      " + pipeline.getState().displayName());
        System.out.println("  Iterations: " + pipeline.getCurrentIteration()
                + (pipeline.getMaxIterations() > 0 ? " of " + pipeline.getMaxIterations() : ""));
        if (pipeline.getCompletedAt() != null) {
            System.out.println("  Duration:   " + formatDuration(
                    pipeline.getCompletedAt().toEpochMilli() - pipeline.getCreatedAt().toEpochMilli()));
        }
        if (pipeline.getFailureReason() != null) {
            System.out.println("  Reason:     " + pipeline.getFailureReason());
        }
    }

    static String statusLabel(RunStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case RUNNING, WAITING_INPUT -> "fg(cyan)";
            case STOPPED -> "fg(yellow)";
            case CRASHED -> "fg(red)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.wireName() + "|@");
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String shortId(String id) {
        if (id == null) return "-";
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String preview(String content) {
        return truncate(content.replace('\n', ' ').strip(), OUTPUT_PREVIEW_CHARS);
    }
}
