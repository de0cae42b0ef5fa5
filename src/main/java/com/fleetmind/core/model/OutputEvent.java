package com.fleetmind.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * One normalized unit of worker output.
 *
 * @param workerId        the worker that produced the output
 * @param outputType      classification of the output
 * @param content         human-readable content
 * @param payload         structured data attached to the output (nullable)
 * @param sessionId       correlation session id (nullable)
 * @param uuid            message uuid (nullable)
 * @param parentToolUseId id of the tool call this output belongs to (nullable)
 * @param subtype         message subtype (nullable)
 * @param byteSize        size of {@code content} in UTF-8 bytes
 * @param timestamp       when the line was read
 */
public record OutputEvent(
    String workerId,
    OutputType outputType,
    String content,
    JsonNode payload,
    String sessionId,
    String uuid,
    String parentToolUseId,
    String subtype,
    long byteSize,
    Instant timestamp
) {

    public static OutputEvent of(String workerId, OutputType type, String content, JsonNode payload,
                                 MessageHeader header, Instant timestamp) {
        String text = content != null ? content : "";
        return new OutputEvent(workerId, type, text, payload,
                header.sessionId(), header.uuid(), header.parentToolUseId(), header.subtype(),
                text.getBytes(StandardCharsets.UTF_8).length, timestamp);
    }

    /** Correlation fields shared by every event decoded from the same line. */
    public record MessageHeader(String sessionId, String uuid, String parentToolUseId, String subtype) {
        public static final MessageHeader EMPTY = new MessageHeader(null, null, null, null);
    }
}
