package com.phillippitts.interviewcopilot.client.transport;

import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.protocol.ErrorCode;
import com.phillippitts.interviewcopilot.protocol.Payloads;

/**
 * Inbound events delivered by a {@link SessionTransport}, in wire order.
 */
public sealed interface TransportEvent {

    record TranscriptionUpdate(String text, String accumulatedText, boolean isFinal) implements TransportEvent { }

    record QuestionDetected(String questionId, String question, QuestionType type) implements TransportEvent { }

    /** One streamed piece of the answer to {@code questionId}; an {@link AnswerReady} always follows. */
    record AnswerChunkReceived(String questionId, int index, String delta) implements TransportEvent { }

    record AnswerReady(Payloads.Answer answer) implements TransportEvent { }

    /** Server-reported error, or a local transport failure ({@link ErrorCode#TRANSPORT_DISCONNECTED}). */
    record ErrorReceived(ErrorCode code, String message, String questionId) implements TransportEvent { }

    record StatusReceived(String state, String detail) implements TransportEvent { }

    record ConnectionStatusChanged(ConnectionStatus status, int attempt) implements TransportEvent { }

    enum ConnectionStatus {
        CONNECTED,
        /** Unexpected closure; a reconnect attempt is scheduled. */
        RECONNECTING,
        /** Reconnected; the caller must resend context before audio flows again. */
        RECONNECTED,
        /** Closed by the caller, or reconnect attempts exhausted. */
        DISCONNECTED
    }
}
