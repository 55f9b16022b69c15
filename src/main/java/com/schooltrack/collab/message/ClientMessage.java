package com.schooltrack.collab.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Inbound envelope: {@code {type, roomId, payload}}.
 */
public record ClientMessage(
    String type,
    String roomId,
    JsonNode payload
) {

    public Optional<String> payloadText(String field) {
        if (payload == null || !payload.hasNonNull(field)) {
            return Optional.empty();
        }
        JsonNode value = payload.get(field);
        return value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }
}
