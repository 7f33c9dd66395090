// file: server/src/main/java/io/tagvault/server/command/Payloads.java
package io.tagvault.server.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.server.error.ValidationException;

/**
 * Field extraction from a request payload. Type errors are validation errors.
 */
final class Payloads {

    private Payloads() {
    }

    static String required(JsonNode payload, String field) {
        String v = optional(payload, field);
        if (v == null || v.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        return v;
    }

    /** @return the string value, or null when the field is absent or JSON null */
    static String optional(JsonNode payload, String field) {
        if (payload == null || payload.isNull()) return null;
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) {
            throw new ValidationException(field, field + " must be a string");
        }
        return node.asText();
    }
}
