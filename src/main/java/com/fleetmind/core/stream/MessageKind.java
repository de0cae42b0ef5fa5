package com.fleetmind.core.stream;

/**
 * Discriminator values of the worker stream protocol.
 */
public enum MessageKind {
    SYSTEM("system"),
    ASSISTANT("assistant"),
    USER("user"),
    RESULT("result"),
    STREAM_EVENT("stream_event"),
    UNKNOWN("");

    private final String typeName;

    MessageKind(String typeName) {
        this.typeName = typeName;
    }

    static MessageKind fromType(String type) {
        for (MessageKind kind : values()) {
            if (kind != UNKNOWN && kind.typeName.equals(type)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
