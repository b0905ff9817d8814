package com.phillippitts.interviewcopilot.client.transport;

import com.phillippitts.interviewcopilot.client.session.SessionConfig;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.QuestionType;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Client side of the duplex session channel.
 *
 * Contract:
 * - Sends are transmitted in call order; audio is never retransmitted
 * - Audio is dropped until {@link #sendContext} has been issued on the current connection
 * - Unexpected closure triggers capped exponential reconnect; on success a
 *   {@link TransportEvent.ConnectionStatus#RECONNECTED} event asks the caller to resend context
 * - Inbound events are delivered to the consumer one at a time, in wire order
 */
public interface SessionTransport {

    /**
     * Opens the channel.
     *
     * @return completes when connected, or exceptionally with
     *         {@link com.phillippitts.interviewcopilot.exception.TransportDisconnectedException}
     */
    CompletableFuture<Void> connect(SessionConfig config, Consumer<? super TransportEvent> events);

    boolean isConnected();

    /** @return false if the chunk was dropped (not connected, or context not yet sent) */
    boolean sendAudio(AudioChunk chunk);

    void sendContext(ContextPayload payload);

    /** Asks the server to (re)generate an answer for this question, bypassing detection. */
    void requestAnswer(String question, QuestionType type);

    /** Forces a question boundary at the current transcript state. */
    void finalizeAudio();

    /** Resets the server-side transcript and context without closing the channel. */
    void clearSession();

    void configure(String language);

    /** Closes the channel without reconnecting. */
    CompletableFuture<Void> close();
}
