package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputEvent.MessageHeader;
import com.fleetmind.core.model.OutputType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies lines of worker output into {@link OutputEvent}s and a {@link LifecycleSignal}.
 * <p>
 * Classification depends only on the line; the clock supplies event timestamps.
 * Malformed input never throws and is reported as plain text.
 */
@Component
public class StreamParser {

    private final StreamMessageDecoder decoder;
    private final Clock clock;

    @Autowired
    public StreamParser(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    StreamParser(ObjectMapper objectMapper, Clock clock) {
        this.decoder = new StreamMessageDecoder(objectMapper);
        this.clock = clock;
    }

    public ParseResult parse(String workerId, String line) {
        return parse(workerId, line, Instant.now(clock));
    }

    public ParseResult parse(String workerId, String line, Instant at) {
        var decoded = decoder.decode(line);
        if (decoded.isEmpty()) {
            OutputEvent plain = OutputEvent.of(workerId, OutputType.PLAIN_TEXT, line, null, MessageHeader.EMPTY, at);
            return new ParseResult(List.of(plain), LifecycleSignal.NONE, null, null, 0, null);
        }

        StreamMessage message = decoded.get();
        String sessionId = message.header().sessionId();
        return switch (message.kind()) {
            case SYSTEM -> single(workerId, OutputType.SYSTEM,
                    systemContent((StreamMessage.SystemInfo) message), message, sessionId, at);
            case ASSISTANT -> assistant(workerId, (StreamMessage.Assistant) message, at);
            case USER -> user(workerId, (StreamMessage.User) message, at);
            case RESULT -> result(workerId, (StreamMessage.Result) message, at);
            case STREAM_EVENT -> single(workerId, OutputType.STREAM_EVENT,
                    streamContent((StreamMessage.StreamEvent) message), message, sessionId, at);
            case UNKNOWN -> {
                OutputEvent event = OutputEvent.of(workerId, OutputType.UNKNOWN,
                        ((StreamMessage.Unknown) message).line(), null, message.header(), at);
                yield new ParseResult(List.of(event), LifecycleSignal.NONE, sessionId, null, 0, null);
            }
        };
    }

    private static ParseResult single(String workerId, OutputType type, String content,
                                      StreamMessage message, String sessionId, Instant at) {
        OutputEvent event = OutputEvent.of(workerId, type, content, message.raw(), message.header(), at);
        return new ParseResult(List.of(event), LifecycleSignal.NONE, sessionId, null, 0, null);
    }

    private static ParseResult assistant(String workerId, StreamMessage.Assistant message, Instant at) {
        List<OutputEvent> events = new ArrayList<>();
        String lastText = null;
        int toolCalls = 0;
        for (ContentBlock block : message.blocks()) {
            if (block instanceof ContentBlock.Text text) {
                events.add(OutputEvent.of(workerId, OutputType.TEXT, text.text(), null, message.header(), at));
                lastText = text.text();
            } else if (block instanceof ContentBlock.ToolUse toolUse) {
                String content = "Using tool: " + toolUse.name() + "\nInput:\n" + pretty(toolUse.input());
                events.add(OutputEvent.of(workerId, OutputType.TOOL_USE, content, toolUse.input(),
                        message.header(), at));
                toolCalls++;
            }
        }

        LifecycleSignal signal;
        if (toolCalls > 0) {
            signal = LifecycleSignal.TOOL_INVOKED;
        } else if ("end_turn".equals(message.stopReason())) {
            signal = LifecycleSignal.TURN_ENDED;
        } else {
            signal = LifecycleSignal.CONTINUING;
        }
        return new ParseResult(events, signal, message.header().sessionId(), lastText, toolCalls, null);
    }

    private static ParseResult user(String workerId, StreamMessage.User message, Instant at) {
        List<OutputEvent> events = new ArrayList<>();
        for (ContentBlock block : message.blocks()) {
            if (block instanceof ContentBlock.ToolResult toolResult) {
                JsonNode content = toolResult.content();
                String text = content == null ? "" : content.isTextual() ? content.asText() : pretty(content);
                OutputType type = toolResult.isError() ? OutputType.ERROR : OutputType.TOOL_RESULT;
                events.add(OutputEvent.of(workerId, type, text, content, message.header(), at));
            }
        }
        return new ParseResult(events, LifecycleSignal.NONE, message.header().sessionId(), null, 0, null);
    }

    private static ParseResult result(String workerId, StreamMessage.Result message, Instant at) {
        OutputEvent event = OutputEvent.of(workerId, OutputType.RESULT, resultContent(message), message.raw(),
                message.header(), at);
        LifecycleSignal signal = message.succeeded() ? LifecycleSignal.TURN_SUCCEEDED : LifecycleSignal.TURN_FAILED;
        return new ParseResult(List.of(event), signal, message.header().sessionId(), null, 0, message.usage());
    }

    static String systemContent(StreamMessage.SystemInfo message) {
        if (message.message() != null) {
            return message.message();
        }
        if (message.model() != null) {
            return "Session initialized with %s (%d tools available)".formatted(message.model(), message.toolCount());
        }
        String subtype = message.header().subtype();
        return subtype != null ? "System: " + subtype : "System event";
    }

    static String resultContent(StreamMessage.Result message) {
        JsonNode result = message.result();
        if (result != null) {
            if (result.isTextual()) {
                return result.asText();
            }
            var summary = JsonFields.text(result, "summary").or(() -> JsonFields.text(result, "message"));
            if (summary.isPresent()) {
                return summary.get();
            }
            StringBuilder text = new StringBuilder("Task completed");
            JsonFields.unsignedLong(message.raw(), "duration_ms")
                    .ifPresent(ms -> text.append(String.format(Locale.ROOT, " in %.1fs", ms / 1000.0)));
            var cost = JsonFields.number(message.raw(), "total_cost_usd");
            if (cost.isEmpty()) {
                cost = JsonFields.number(message.raw(), "cost_usd");
            }
            cost.ifPresent(c -> text.append(String.format(Locale.ROOT, " ($%.4f)", c)));
            return text.toString();
        }
        if (message.error() != null) {
            return "Error: " + message.error();
        }
        String subtype = message.header().subtype();
        if ("success".equals(subtype)) {
            return "Task completed successfully";
        }
        return "error".equals(subtype) ? "Task failed" : "Result";
    }

    static String streamContent(StreamMessage.StreamEvent message) {
        String event = message.event() != null ? message.event() : "stream";
        JsonNode data = message.data();
        if (data != null) {
            if (data.isTextual()) {
                return data.asText();
            }
            var text = JsonFields.text(data, "message");
            if (text.isPresent()) {
                return text.get();
            }
            return JsonFields.text(data, "status")
                    .map(status -> event + ": " + status)
                    .orElse("Stream: " + event);
        }
        return message.message() != null ? message.message() : "Stream: " + event;
    }

    private static String pretty(JsonNode node) {
        return node == null ? "null" : node.toPrettyString();
    }
}
