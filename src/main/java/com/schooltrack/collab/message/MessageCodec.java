package com.schooltrack.collab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schooltrack.collab.error.MalformedMessageException;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * JSON encoding of the wire envelope.
 */
@ApplicationScoped
public class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Parses an inbound envelope and checks that its type is one a client may send.
     *
     * @throws MalformedMessageException if the text is not a valid envelope
     */
    public ClientMessage decode(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("Empty message");
        }
        ClientMessage message;
        try {
            message = mapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unreadable message: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.type() == null) {
            throw new MalformedMessageException("Message type required");
        }
        MessageType type = MessageType.fromWire(message.type())
            .orElseThrow(() -> new MalformedMessageException("Unknown message type: " + message.type()));
        if (!type.acceptedFromClient()) {
            throw new MalformedMessageException("Message type not accepted from clients: " + message.type());
        }
        return message;
    }

    public String encode(ServerMessage message) {
        return write(message);
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unreadable message: " + e.getOriginalMessage(), e);
        }
    }
}
