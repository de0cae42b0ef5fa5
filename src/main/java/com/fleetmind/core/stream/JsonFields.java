package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Optional-returning field accessors for protocol messages. A missing field, a null,
 * or a value of the wrong JSON type all read as empty.
 */
final class JsonFields {

    private JsonFields() {}

    static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    static Optional<JsonNode> object(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isObject() ? Optional.of(value) : Optional.empty();
    }

    static Optional<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isArray() ? Optional.of(value) : Optional.empty();
    }

    static Optional<JsonNode> present(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && !value.isNull() && !value.isMissingNode() ? Optional.of(value) : Optional.empty();
    }

    static OptionalLong unsignedLong(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value != null && value.isIntegralNumber() && value.asLong() >= 0) {
            return OptionalLong.of(value.asLong());
        }
        return OptionalLong.empty();
    }

    static OptionalDouble number(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isNumber() ? OptionalDouble.of(value.asDouble()) : OptionalDouble.empty();
    }

    static boolean flag(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isBoolean() && value.asBoolean();
    }
}
