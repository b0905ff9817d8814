package com.phillippitts.interviewcopilot.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * Envelope types on the session channel.
 *
 * <p>Client-to-server types are commands; server-to-client types are events.
 */
public enum MessageType {
    // client -> server
    CONTEXT(Direction.CLIENT_TO_SERVER),
    REQUEST_ANSWER(Direction.CLIENT_TO_SERVER),
    FINALIZE(Direction.CLIENT_TO_SERVER),
    CLEAR(Direction.CLIENT_TO_SERVER),
    CONFIG(Direction.CLIENT_TO_SERVER),

    // server -> client
    TRANSCRIPTION(Direction.SERVER_TO_CLIENT),
    QUESTION_DETECTED(Direction.SERVER_TO_CLIENT),
    ANSWER_CHUNK(Direction.SERVER_TO_CLIENT),
    ANSWER(Direction.SERVER_TO_CLIENT),
    ERROR(Direction.SERVER_TO_CLIENT),
    STATUS(Direction.SERVER_TO_CLIENT);

    public enum Direction { CLIENT_TO_SERVER, SERVER_TO_CLIENT }

    private final Direction direction;

    MessageType(Direction direction) {
        this.direction = direction;
    }

    public Direction direction() {
        return direction;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MessageType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (MessageType t : values()) {
            if (t.wireName().equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
