package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetmind.core.model.OutputEvent.MessageHeader;
import com.fleetmind.core.model.UsageReport;

import java.util.List;

/**
 * A decoded protocol line. There is one variant per {@link MessageKind}; {@link #kind()}
 * tells which, so callers dispatch with an exhaustive switch over the kind.
 */
public interface StreamMessage {

    MessageKind kind();

    MessageHeader header();

    /** The decoded JSON object the message came from. */
    JsonNode raw();

    record SystemInfo(MessageHeader header, JsonNode raw, String message, String model, Integer toolCount)
            implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.SYSTEM;
        }
    }

    record Assistant(MessageHeader header, JsonNode raw, List<ContentBlock> blocks, String stopReason)
            implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.ASSISTANT;
        }
    }

    record User(MessageHeader header, JsonNode raw, List<ContentBlock> blocks) implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.USER;
        }
    }

    /**
     * @param result   the {@code result} field as found (string or object, nullable)
     * @param error    the {@code error} field when it is a string (nullable)
     * @param usage    usage figures reported with the result
     */
    record Result(MessageHeader header, JsonNode raw, JsonNode result, String error, UsageReport usage)
            implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.RESULT;
        }

        public boolean succeeded() {
            return "success".equals(header.subtype());
        }
    }

    record StreamEvent(MessageHeader header, JsonNode raw, String event, JsonNode data, String message)
            implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.STREAM_EVENT;
        }
    }

    /** A structured line whose type is not part of the protocol, kept verbatim. */
    record Unknown(MessageHeader header, JsonNode raw, String line) implements StreamMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.UNKNOWN;
        }
    }
}
