package com.phillippitts.interviewcopilot.testutil;

import com.phillippitts.interviewcopilot.client.session.SessionConfig;
import com.phillippitts.interviewcopilot.client.transport.SessionTransport;
import com.phillippitts.interviewcopilot.client.transport.TransportEvent;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.exception.TransportDisconnectedException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory SessionTransport that records every outbound call as a short string
 * ({@code "context"}, {@code "audio:3"}, {@code "request:Why?:behavioral"}, ...).
 *
 * <p>Honours the audio gating contract: chunks are dropped until context is sent on the
 * current connection. Tests deliver inbound events with {@link #emit}.
 */
public class FakeSessionTransport implements SessionTransport {
    public final List<String> calls = new CopyOnWriteArrayList<>();
    public volatile boolean failConnect;
    public volatile boolean connected;
    public volatile ContextPayload lastContext;

    private volatile boolean contextSent;
    private volatile Consumer<? super TransportEvent> events;

    @Override
    public CompletableFuture<Void> connect(SessionConfig config, Consumer<? super TransportEvent> events) {
        calls.add("connect");
        if (failConnect) {
            return CompletableFuture.failedFuture(new TransportDisconnectedException("refused"));
        }
        this.events = events;
        connected = true;
        events.accept(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.CONNECTED, 0));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean sendAudio(AudioChunk chunk) {
        if (!connected || !contextSent) {
            return false;
        }
        calls.add("audio:" + chunk.sequence());
        return true;
    }

    @Override
    public void sendContext(ContextPayload payload) {
        calls.add("context");
        lastContext = payload;
        contextSent = connected;
    }

    @Override
    public void requestAnswer(String question, QuestionType type) {
        calls.add("request:" + question + ":" + (type == null ? "" : type.wireName()));
    }

    @Override
    public void finalizeAudio() {
        calls.add("finalize");
    }

    @Override
    public void clearSession() {
        calls.add("clear");
    }

    @Override
    public void configure(String language) {
        calls.add("configure:" + language);
    }

    @Override
    public CompletableFuture<Void> close() {
        calls.add("close");
        connected = false;
        contextSent = false;
        emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.DISCONNECTED, 0));
        return CompletableFuture.completedFuture(null);
    }

    /** Simulates a reconnect: context must be sent again before audio flows. */
    public void reconnected(int attempt) {
        contextSent = false;
        connected = true;
        emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.RECONNECTED, attempt));
    }

    public void emit(TransportEvent event) {
        Consumer<? super TransportEvent> consumer = events;
        if (consumer != null) {
            consumer.accept(event);
        }
    }
}
