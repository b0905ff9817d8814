package com.phillippitts.interviewcopilot.client.session;

import com.phillippitts.interviewcopilot.client.audio.AudioCaptureEngine;
import com.phillippitts.interviewcopilot.client.audio.CaptureEvent;
import com.phillippitts.interviewcopilot.client.profile.ProfileLookup;
import com.phillippitts.interviewcopilot.client.transport.SessionTransport;
import com.phillippitts.interviewcopilot.client.transport.TransportEvent;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.exception.DeviceUnavailableException;
import com.phillippitts.interviewcopilot.protocol.ErrorCode;
import com.phillippitts.interviewcopilot.service.events.EventChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Drives one client session: microphone, transport and state machine.
 *
 * <p>Capture and transport events are funnelled through a single {@link EventChannel}, so the
 * coordinator reacts to them one at a time in arrival order:
 * <ul>
 *   <li>chunks are forwarded to the transport (dropped by it until context is sent)</li>
 *   <li>detected silence sends {@code finalize}</li>
 *   <li>a reconnect resends the language hint and the context before audio resumes</li>
 *   <li>every transport event updates the {@link SessionStateMachine}</li>
 * </ul>
 */
public class LiveSessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(LiveSessionCoordinator.class);

    private sealed interface Signal { }

    private record Captured(CaptureEvent event) implements Signal { }

    private record Received(TransportEvent event) implements Signal { }

    private final AudioCaptureEngine capture;
    private final SessionTransport transport;
    private final ProfileLookup profiles;
    private final Executor executor;
    private final SessionStateMachine state = new SessionStateMachine();

    private volatile EventChannel<Signal> channel;
    private volatile SessionConfig config;
    private volatile ContextPayload context = ContextPayload.EMPTY;
    private volatile Consumer<SessionStateMachine.Snapshot> listener = s -> { };

    public LiveSessionCoordinator(AudioCaptureEngine capture, SessionTransport transport,
                                  ProfileLookup profiles, Executor executor) {
        this.capture = Objects.requireNonNull(capture, "capture");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /** Receives a snapshot after every visible state change, on the coordinator loop. */
    public void onChange(Consumer<SessionStateMachine.Snapshot> listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Connects, sends the profile as context, then starts the microphone.
     *
     * <p>Completes exceptionally with {@code TransportDisconnectedException} if the connection
     * cannot be established, or with {@link DeviceUnavailableException} if the microphone cannot
     * be acquired. In the latter case the session stays connected and manual answer requests
     * still work.
     */
    public CompletableFuture<Void> start(SessionConfig config) {
        Objects.requireNonNull(config, "config");
        if (channel != null && !channel.isClosed()) {
            throw new IllegalStateException("Session already started");
        }
        this.config = config;
        this.context = profiles.lookup(config.userId());
        this.channel = new EventChannel<>("client-" + config.userId(), executor,
                Map.of("userId", config.userId()), this::handle);
        state.connecting();
        LOG.info("Starting live session: endpoint={}, userId={}", config.endpoint(), config.userId());

        EventChannel<Signal> events = channel;
        return transport.connect(config, e -> events.publish(new Received(e)))
                .thenRun(this::sendSessionSetup)
                .thenCompose(v -> capture.start(e -> events.publish(new Captured(e))))
                .whenComplete((v, error) -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof DeviceUnavailableException device) {
                        LOG.error("Microphone unavailable ({}): {}", device.getReason(), device.getMessage());
                        state.recordError(ErrorCode.DEVICE_UNAVAILABLE, device.getMessage());
                        publishSnapshot();
                    } else if (cause != null) {
                        LOG.error("Live session failed to start: {}", cause.getMessage());
                    } else {
                        LOG.info("Live session streaming");
                    }
                });
    }

    /** Forces a question boundary now, as if silence had been detected. */
    public void finalizeNow() {
        transport.finalizeAudio();
    }

    /** Requests an answer for explicit question text, bypassing detection. */
    public void requestAnswer(String question) {
        transport.requestAnswer(question, null);
    }

    public void requestAnswer(String question, QuestionType type) {
        transport.requestAnswer(question, type);
    }

    /** Clears server-side session state; context must be sent again before answers are grounded. */
    public void clear() {
        transport.clearSession();
    }

    /** Re-reads the profile and sends it as a new context baseline. */
    public void refreshContext() {
        SessionConfig cfg = config;
        if (cfg == null) {
            throw new IllegalStateException("Session not started");
        }
        context = profiles.lookup(cfg.userId());
        transport.sendContext(context);
    }

    public void pause() {
        capture.pause();
    }

    public void resume() {
        capture.resume();
    }

    public SessionStateMachine.Snapshot snapshot() {
        return state.snapshot();
    }

    /** Stops the microphone first, so the trailing chunk is sent, then closes the transport. */
    public CompletableFuture<Void> stop() {
        LOG.info("Stopping live session");
        return capture.stop()
                .handle((v, e) -> {
                    if (e != null) {
                        LOG.warn("Microphone stop failed: {}", e.toString());
                    }
                    return null;
                })
                .thenCompose(v -> transport.close())
                .whenComplete((v, e) -> {
                    EventChannel<Signal> events = channel;
                    if (events != null) {
                        events.close();
                    }
                });
    }

    private void sendSessionSetup() {
        SessionConfig cfg = config;
        if (cfg.language() != null && !cfg.language().isBlank()) {
            transport.configure(cfg.language());
        }
        transport.sendContext(context);
    }

    private void handle(Signal signal) {
        if (signal instanceof Captured captured) {
            onCapture(captured.event());
        } else if (signal instanceof Received received) {
            onTransport(received.event());
        }
    }

    private void onCapture(CaptureEvent event) {
        if (event instanceof CaptureEvent.ChunkCaptured chunk) {
            transport.sendAudio(chunk.chunk());
        } else if (event instanceof CaptureEvent.SilenceDetected) {
            if (transport.isConnected()) {
                LOG.debug("Silence detected; finalizing");
                transport.finalizeAudio();
            }
        } else if (event instanceof CaptureEvent.CaptureFailed failed) {
            LOG.error("Capture failed: {}", failed.error().getMessage());
            state.recordError(ErrorCode.DEVICE_UNAVAILABLE, failed.error().getMessage());
            publishSnapshot();
        }
        // LevelSampled: the level is read on demand via AudioCaptureEngine#currentLevel
    }

    private void onTransport(TransportEvent event) {
        if (event instanceof TransportEvent.ConnectionStatusChanged change
                && change.status() == TransportEvent.ConnectionStatus.RECONNECTED) {
            LOG.info("Reconnected after {} attempt(s); resending context", change.attempt());
            sendSessionSetup();
        }
        if (event instanceof TransportEvent.AnswerReady ready) {
            LOG.info("Answer for \"{}\" (grounding={}, source={}):\n{}", ready.answer().question(),
                    ready.answer().grounding(), ready.answer().source(), ready.answer().answer());
        } else if (event instanceof TransportEvent.QuestionDetected question) {
            LOG.info("Question detected [{}]: {}", question.type(), question.question());
        } else if (event instanceof TransportEvent.ErrorReceived error) {
            LOG.warn("Server error {}: {}", error.code(), error.message());
        }
        if (state.apply(event)) {
            publishSnapshot();
        }
    }

    private void publishSnapshot() {
        try {
            listener.accept(state.snapshot());
        } catch (RuntimeException e) {
            LOG.warn("State listener failed", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
