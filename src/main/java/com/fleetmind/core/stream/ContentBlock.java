package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One typed entry of a message's {@code content} array.
 */
public interface ContentBlock {

    record Text(String text) implements ContentBlock {}

    record ToolUse(String id, String name, JsonNode input) implements ContentBlock {}

    /**
     * @param content string or structured tool output (nullable)
     */
    record ToolResult(String toolUseId, JsonNode content, boolean isError) implements ContentBlock {}

    /** A block type this parser does not interpret. */
    record Other(String type) implements ContentBlock {}
}
