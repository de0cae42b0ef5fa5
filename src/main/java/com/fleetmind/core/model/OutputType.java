package com.fleetmind.core.model;

/**
 * Classification of one normalized unit of worker output.
 */
public enum OutputType {
    SYSTEM("system"),
    TEXT("text"),
    TOOL_USE("tool_use"),
    TOOL_RESULT("tool_result"),
    ERROR("error"),
    RESULT("result"),
    STREAM_EVENT("stream_event"),
    PLAIN_TEXT("plain_text"),
    UNKNOWN("unknown");

    private final String wireName;

    OutputType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static OutputType fromWireName(String name) {
        for (OutputType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
