package com.phillippitts.interviewcopilot.client.transport;

import com.phillippitts.interviewcopilot.client.session.SessionConfig;
import com.phillippitts.interviewcopilot.config.properties.TransportProperties;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.exception.ProtocolException;
import com.phillippitts.interviewcopilot.exception.TransportDisconnectedException;
import com.phillippitts.interviewcopilot.protocol.AudioFrameCodec;
import com.phillippitts.interviewcopilot.protocol.Envelope;
import com.phillippitts.interviewcopilot.protocol.EnvelopeCodec;
import com.phillippitts.interviewcopilot.protocol.ErrorCode;
import com.phillippitts.interviewcopilot.protocol.MessageType;
import com.phillippitts.interviewcopilot.protocol.Payloads;
import com.phillippitts.interviewcopilot.util.Timeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link SessionTransport} over {@link java.net.http.WebSocket}.
 *
 * <p><b>Sending:</b> every send is chained after the previous one, so at most one send is
 * outstanding and wire order equals call order. Sends while disconnected are dropped.
 *
 * <p><b>Receiving:</b> text frames are reassembled, decoded with {@link EnvelopeCodec}, and
 * delivered as {@link TransportEvent}s. The listener requests one message at a time, so events
 * reach the consumer in wire order.
 *
 * <p><b>Reconnect:</b> an unexpected closure schedules attempts according to
 * {@link ReconnectPolicy}. After a reconnect audio is dropped until the caller resends context.
 * When attempts are exhausted an {@code ErrorReceived(TRANSPORT_DISCONNECTED)} and a
 * {@code DISCONNECTED} status are emitted.
 */
public class WebSocketSessionTransport implements SessionTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketSessionTransport.class);

    static final String USER_ID_HEADER = "X-User-ID";

    private final HttpClient httpClient;
    private final EnvelopeCodec codec;
    private final ReconnectPolicy policy;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private WebSocket socket;
    private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

    private volatile SessionConfig config;
    private volatile Consumer<? super TransportEvent> events;
    private volatile boolean contextSent;
    private volatile boolean closing;
    private volatile long droppedAudio;

    public WebSocketSessionTransport(TransportProperties props, EnvelopeCodec codec) {
        this(HttpClient.newBuilder().connectTimeout(Timeouts.TRANSPORT_CONNECT_TIMEOUT).build(),
                props, codec, Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "transport-reconnect");
                    t.setDaemon(true);
                    return t;
                }));
    }

    // Package-private for tests
    WebSocketSessionTransport(HttpClient httpClient, TransportProperties props, EnvelopeCodec codec,
                              ScheduledExecutorService scheduler) {
        this.httpClient = Objects.requireNonNull(httpClient);
        this.codec = Objects.requireNonNull(codec);
        this.policy = new ReconnectPolicy(Objects.requireNonNull(props));
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    @Override
    public CompletableFuture<Void> connect(SessionConfig config, Consumer<? super TransportEvent> events) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(events, "events");
        synchronized (lock) {
            if (scheduler.isShutdown()) {
                throw new IllegalStateException("Transport has been shut down");
            }
            if (socket != null) {
                throw new IllegalStateException("Transport is already connected");
            }
            this.config = config;
            this.events = events;
            this.closing = false;
        }
        LOG.info("Connecting session transport: endpoint={}, userId={}", config.endpoint(), config.userId());
        return open().handle((ws, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                LOG.warn("Session transport connect failed: endpoint={}, reason={}", config.endpoint(), cause.toString());
                throw new CompletionException(new TransportDisconnectedException(
                        "Failed to connect to " + config.endpoint(), 0, cause));
            }
            LOG.info("Session transport connected");
            emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.CONNECTED, 0));
            return null;
        });
    }

    @Override
    public boolean isConnected() {
        synchronized (lock) {
            return socket != null && !socket.isOutputClosed();
        }
    }

    @Override
    public boolean sendAudio(AudioChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (!contextSent) {
            droppedAudio++;
            LOG.debug("Dropping audio chunk {}: context not sent on this connection (dropped={})",
                    chunk.sequence(), droppedAudio);
            return false;
        }
        ByteBuffer frame = AudioFrameCodec.encode(chunk);
        return enqueue(ws -> ws.sendBinary(frame, true), "audio#" + chunk.sequence());
    }

    @Override
    public void sendContext(ContextPayload payload) {
        Objects.requireNonNull(payload, "payload");
        if (sendText(MessageType.CONTEXT, payload)) {
            contextSent = true;
        }
    }

    @Override
    public void requestAnswer(String question, QuestionType type) {
        sendText(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(question, type == null ? null : type.wireName()));
    }

    @Override
    public void finalizeAudio() {
        sendText(MessageType.FINALIZE, null);
    }

    @Override
    public void clearSession() {
        sendText(MessageType.CLEAR, null);
    }

    @Override
    public void configure(String language) {
        sendText(MessageType.CONFIG, new Payloads.Config(language));
    }

    @Override
    public CompletableFuture<Void> close() {
        closing = true;
        WebSocket ws;
        CompletableFuture<?> pending;
        synchronized (lock) {
            ws = socket;
            socket = null;
            pending = sendChain;
            contextSent = false;
        }
        if (ws == null) {
            return CompletableFuture.completedFuture(null);
        }
        LOG.info("Closing session transport");
        return pending.handle((r, e) -> null)
                .thenCompose(v -> ws.sendClose(WebSocket.NORMAL_CLOSURE, "client closed"))
                .handle((r, e) -> {
                    if (e != null) {
                        LOG.debug("Close handshake failed; aborting: {}", e.toString());
                        ws.abort();
                    }
                    emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.DISCONNECTED, 0));
                    return null;
                });
    }

    /**
     * Closes the channel and stops the reconnect scheduler. Unlike {@link #close()}, the transport
     * cannot connect again afterwards.
     */
    public void shutdown() {
        close();
        scheduler.shutdownNow();
        LOG.debug("Session transport shut down");
    }

    long droppedAudioCount() {
        return droppedAudio;
    }

    private CompletableFuture<WebSocket> open() {
        SessionConfig cfg = config;
        return httpClient.newWebSocketBuilder()
                .header(USER_ID_HEADER, cfg.userId())
                .connectTimeout(Timeouts.TRANSPORT_CONNECT_TIMEOUT)
                .buildAsync(cfg.endpoint(), new Listener())
                .thenApply(ws -> {
                    synchronized (lock) {
                        socket = ws;
                        sendChain = CompletableFuture.completedFuture(null);
                        contextSent = false;
                    }
                    return ws;
                });
    }

    private boolean sendText(MessageType type, Object payload) {
        String json = codec.encode(type, payload);
        return enqueue(ws -> ws.sendText(json, true), type.wireName());
    }

    private boolean enqueue(Function<WebSocket, CompletableFuture<WebSocket>> send, String what) {
        synchronized (lock) {
            WebSocket ws = socket;
            if (ws == null) {
                LOG.debug("Not connected; dropping {}", what);
                return false;
            }
            sendChain = sendChain
                    .handle((r, e) -> null)
                    .thenCompose(v -> send.apply(ws))
                    .whenComplete((r, e) -> {
                        if (e != null) {
                            LOG.warn("Send of {} failed: {}", what, e.toString());
                        }
                    });
            return true;
        }
    }

    private void onDisconnected(WebSocket ws, String reason) {
        synchronized (lock) {
            if (ws != socket) {
                return; // stale socket, or closed by us
            }
            socket = null;
            contextSent = false;
        }
        if (closing) {
            return;
        }
        LOG.warn("Session transport lost: {}; reconnecting", reason);
        emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.RECONNECTING, 1));
        scheduleReconnect(1);
    }

    private void scheduleReconnect(int attempt) {
        if (scheduler.isShutdown()) {
            return;
        }
        long delayMs = policy.delayFor(attempt).toMillis();
        LOG.info("Reconnect attempt {}/{} in {}ms", attempt, policy.maxAttempts(), delayMs);
        scheduler.schedule(() -> reconnect(attempt), delayMs, TimeUnit.MILLISECONDS);
    }

    private void reconnect(int attempt) {
        if (closing) {
            return;
        }
        open().whenComplete((ws, error) -> {
            if (error == null) {
                LOG.info("Session transport reconnected after {} attempt(s); context must be resent", attempt);
                emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.RECONNECTED, attempt));
                return;
            }
            int next = attempt + 1;
            if (closing) {
                return;
            }
            if (policy.isExhausted(next)) {
                LOG.error("Session transport disconnected: {} reconnect attempts failed", attempt);
                emit(new TransportEvent.ErrorReceived(ErrorCode.TRANSPORT_DISCONNECTED,
                        "Connection lost after " + attempt + " reconnect attempts", null));
                emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.DISCONNECTED, attempt));
                return;
            }
            emit(new TransportEvent.ConnectionStatusChanged(TransportEvent.ConnectionStatus.RECONNECTING, next));
            scheduleReconnect(next);
        });
    }

    private void onMessage(String text) {
        Envelope envelope;
        try {
            envelope = codec.decode(text);
        } catch (ProtocolException e) {
            LOG.warn("Ignoring undecodable server message: {}", e.getMessage());
            return;
        }
        TransportEvent event = toEvent(envelope);
        if (event != null) {
            emit(event);
        }
    }

    // Package-private for tests
    TransportEvent toEvent(Envelope envelope) {
        try {
            switch (envelope.type()) {
                case TRANSCRIPTION: {
                    Payloads.Transcription t = codec.payload(envelope, Payloads.Transcription.class);
                    return new TransportEvent.TranscriptionUpdate(t.text(), t.accumulatedText(), t.isFinal());
                }
                case QUESTION_DETECTED: {
                    Payloads.QuestionDetected q = codec.payload(envelope, Payloads.QuestionDetected.class);
                    return new TransportEvent.QuestionDetected(q.questionId(), q.question(),
                            QuestionType.fromWire(q.questionType()));
                }
                case ANSWER_CHUNK: {
                    Payloads.AnswerChunk c = codec.payload(envelope, Payloads.AnswerChunk.class);
                    return new TransportEvent.AnswerChunkReceived(c.questionId(), c.index(), c.delta());
                }
                case ANSWER:
                    return new TransportEvent.AnswerReady(codec.payload(envelope, Payloads.Answer.class));
                case ERROR: {
                    Payloads.ErrorInfo e = codec.payload(envelope, Payloads.ErrorInfo.class);
                    return new TransportEvent.ErrorReceived(ErrorCode.fromWire(e.code()), e.message(), e.questionId());
                }
                case STATUS: {
                    Payloads.Status s = codec.payload(envelope, Payloads.Status.class);
                    return new TransportEvent.StatusReceived(s.state(), s.detail());
                }
                default:
                    LOG.warn("Ignoring client-bound message type from server: {}", envelope.type().wireName());
                    return null;
            }
        } catch (ProtocolException e) {
            LOG.warn("Ignoring malformed {} message: {}", envelope.type().wireName(), e.getMessage());
            return null;
        }
    }

    private void emit(TransportEvent event) {
        Consumer<? super TransportEvent> consumer = events;
        if (consumer != null) {
            consumer.accept(event);
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder text = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                onMessage(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            LOG.debug("Ignoring binary frame from server ({} bytes)", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            onDisconnected(webSocket, "closed by server (" + statusCode + (reason.isEmpty() ? "" : ", " + reason) + ")");
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            onDisconnected(webSocket, "transport error: " + error);
        }
    }
}
