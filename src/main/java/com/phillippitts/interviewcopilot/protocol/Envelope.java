package com.phillippitts.interviewcopilot.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Decoded text frame: a message type and its still-untyped payload.
 *
 * @param type message type
 * @param payload payload tree (an empty object when the frame carried none)
 */
public record Envelope(MessageType type, JsonNode payload) {
    public Envelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
    }
}
