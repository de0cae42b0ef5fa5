package com.fleetmind.core.stream;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.UsageReport;

import java.util.List;
import java.util.Optional;

/**
 * Everything the supervisor needs from one line of worker output.
 *
 * @param events    normalized events in line order
 * @param signal    lifecycle signal carried by the line
 * @param sessionId session id seen on the line (nullable)
 * @param lastText  last text block of the line (nullable)
 * @param toolCalls number of tool invocations on the line
 * @param usage     usage figures from a result message (nullable)
 */
public record ParseResult(
    List<OutputEvent> events,
    LifecycleSignal signal,
    String sessionId,
    String lastText,
    int toolCalls,
    UsageReport usage
) {

    public ParseResult {
        events = List.copyOf(events);
    }

    public Optional<String> session() {
        return Optional.ofNullable(sessionId);
    }

    public Optional<UsageReport> usageReport() {
        return Optional.ofNullable(usage);
    }
}
