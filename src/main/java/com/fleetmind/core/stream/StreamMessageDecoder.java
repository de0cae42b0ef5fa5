package com.fleetmind.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.model.OutputEvent.MessageHeader;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes one protocol line into a {@link StreamMessage}.
 * <p>
 * Lines that are not a JSON object decode to empty; callers treat them as plain text.
 * Decoding never throws.
 */
public class StreamMessageDecoder {

    private final ObjectMapper objectMapper;

    public StreamMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<StreamMessage> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (json == null || !json.isObject()) {
            return Optional.empty();
        }

        MessageHeader header = new MessageHeader(
                JsonFields.text(json, "session_id").orElse(null),
                JsonFields.text(json, "uuid").orElse(null),
                JsonFields.text(json, "parent_tool_use_id").orElse(null),
                JsonFields.text(json, "subtype").orElse(null));

        MessageKind kind = MessageKind.fromType(JsonFields.text(json, "type").orElse(""));
        StreamMessage message = switch (kind) {
            case SYSTEM -> systemMessage(header, json);
            case ASSISTANT -> new StreamMessage.Assistant(header, json, blocks(json),
                    JsonFields.object(json, "message").flatMap(m -> JsonFields.text(m, "stop_reason")).orElse(null));
            case USER -> new StreamMessage.User(header, json, blocks(json));
            case RESULT -> new StreamMessage.Result(header, json,
                    JsonFields.present(json, "result").orElse(null),
                    JsonFields.text(json, "error").orElse(null),
                    UsageExtractor.extract(json));
            case STREAM_EVENT -> new StreamMessage.StreamEvent(header, json,
                    JsonFields.text(json, "event").orElse(null),
                    JsonFields.present(json, "data").orElse(null),
                    JsonFields.text(json, "message").orElse(null));
            case UNKNOWN -> new StreamMessage.Unknown(header, json, line);
        };
        return Optional.of(message);
    }

    private static StreamMessage.SystemInfo systemMessage(MessageHeader header, JsonNode json) {
        // Init details arrive either nested under "init" or at the top level of an init message.
        Optional<JsonNode> init = JsonFields.object(json, "init");
        if (init.isEmpty() && "init".equals(header.subtype())) {
            init = Optional.of(json);
        }
        String model = init.map(i -> JsonFields.text(i, "model").orElse("unknown")).orElse(null);
        Integer toolCount = init.map(i -> JsonFields.array(i, "tools").map(JsonNode::size).orElse(0)).orElse(null);
        return new StreamMessage.SystemInfo(header, json, JsonFields.text(json, "message").orElse(null),
                model, toolCount);
    }

    private static List<ContentBlock> blocks(JsonNode json) {
        List<ContentBlock> blocks = new ArrayList<>();
        JsonFields.object(json, "message")
                .flatMap(m -> JsonFields.array(m, "content"))
                .ifPresent(content -> content.forEach(block -> blocks.add(block(block))));
        return blocks;
    }

    private static ContentBlock block(JsonNode block) {
        String type = JsonFields.text(block, "type").orElse("");
        return switch (type) {
            case "text" -> JsonFields.text(block, "text")
                    .<ContentBlock>map(ContentBlock.Text::new)
                    .orElseGet(() -> new ContentBlock.Other(type));
            case "tool_use" -> new ContentBlock.ToolUse(
                    JsonFields.text(block, "id").orElse(null),
                    JsonFields.text(block, "name").orElse("unknown"),
                    JsonFields.present(block, "input").orElse(null));
            case "tool_result" -> new ContentBlock.ToolResult(
                    JsonFields.text(block, "tool_use_id").orElse(null),
                    JsonFields.present(block, "content").orElse(null),
                    JsonFields.flag(block, "is_error"));
            default -> new ContentBlock.Other(type);
        };
    }
}
