package com.schooltrack.collab.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.schooltrack.collab.error.ErrorCode;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.lock.DocumentLock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    void decodesEnvelopeAndIgnoresUnknownFields() {
        ClientMessage message = codec.decode(
            "{\"type\":\"chatMessage\",\"roomId\":\"doc-1\",\"payload\":{\"text\":\"hi\",\"toUserId\":\"bob\"},\"extra\":1}");

        Assertions.assertEquals("chatMessage", message.type());
        Assertions.assertEquals("doc-1", message.roomId());
        Assertions.assertEquals("hi", message.payloadText("text").orElseThrow());
        Assertions.assertEquals("bob", message.payloadText("toUserId").orElseThrow());
        Assertions.assertTrue(message.payloadText("missing").isEmpty());
    }

    @Test
    void nonTextPayloadFieldIsAbsent() {
        ClientMessage message = codec.decode("{\"type\":\"chatMessage\",\"roomId\":\"doc-1\",\"payload\":{\"text\":42}}");

        Assertions.assertTrue(message.payloadText("text").isEmpty());
    }

    @Test
    void rejectsAnythingThatIsNotAClientEnvelope() {
        for (String json : new String[] {
            "",
            "   ",
            "{broken",
            "[]",
            "{\"roomId\":\"doc-1\"}",
            "{\"type\":\"teleport\"}",
            "{\"type\":\"forceDisconnect\"}",
        }) {
            MalformedMessageException e = Assertions.assertThrows(MalformedMessageException.class,
                () -> codec.decode(json), json);
            Assertions.assertEquals(ErrorCode.MALFORMED_MESSAGE, e.code());
        }
    }

    @Test
    void encodesWireNamesAndIsoTimestamps() {
        Instant at = Instant.parse("2025-03-01T09:00:00Z");
        JsonNode lock = codec.readTree(codec.encode(
            ServerMessage.lockGranted(new DocumentLock("doc-1", "alice", "Alice", at, null))));

        Assertions.assertEquals("lockGranted", lock.get("type").asText());
        Assertions.assertEquals("doc-1", lock.get("roomId").asText());
        Assertions.assertEquals("2025-03-01T09:00:00Z", lock.at("/payload/acquiredAt").asText());
        Assertions.assertFalse(lock.get("payload").has("expiresAt"));

        JsonNode error = codec.readTree(codec.encode(ServerMessage.error(ErrorCode.NOT_JOINED, "nope")));
        Assertions.assertEquals("not_joined", error.at("/payload/code").asText());

        JsonNode forced = codec.readTree(codec.encode(ServerMessage.forceDisconnect(null, DisconnectReason.IDLE_TIMEOUT)));
        Assertions.assertEquals("idle", forced.at("/payload/reason").asText());
        Assertions.assertFalse(forced.has("roomId"));
    }
}
