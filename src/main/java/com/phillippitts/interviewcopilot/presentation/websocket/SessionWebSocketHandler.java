package com.phillippitts.interviewcopilot.presentation.websocket;

import com.phillippitts.interviewcopilot.exception.SessionLimitExceededException;
import com.phillippitts.interviewcopilot.service.session.LiveSession;
import com.phillippitts.interviewcopilot.service.session.SessionPipeline;
import com.phillippitts.interviewcopilot.service.session.SessionSink;
import com.phillippitts.interviewcopilot.util.Timeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Objects;

/**
 * WebSocket boundary of the live session protocol.
 *
 * <p>Binary frames carry audio, text frames carry JSON envelopes. The handler only maps
 * connection callbacks to the {@link SessionPipeline}; all ordering, error mapping and event
 * delivery happen there.
 */
public class SessionWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SessionWebSocketHandler.class);

    static final String LIVE_SESSION_ATTRIBUTE = "copilot.liveSession";

    private final SessionPipeline pipeline;

    public SessionWebSocketHandler(SessionPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String userId = (String) session.getAttributes()
                .getOrDefault(IdentityHandshakeInterceptor.USER_ID_ATTRIBUTE, IdentityHandshakeInterceptor.ANONYMOUS);
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(session,
                (int) Timeouts.WEBSOCKET_SEND_TIME_LIMIT.toMillis(), Timeouts.WEBSOCKET_SEND_BUFFER_LIMIT);
        try {
            LiveSession live = pipeline.open(session.getId(), userId, new WebSocketSink(outbound));
            session.getAttributes().put(LIVE_SESSION_ATTRIBUTE, live);
        } catch (SessionLimitExceededException e) {
            LOG.warn("Refusing session {}: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.SERVICE_OVERLOAD.withReason("Session limit reached"));
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        LiveSession live = liveSession(session);
        if (live != null) {
            pipeline.onAudioFrame(live, message.getPayload());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        LiveSession live = liveSession(session);
        if (live != null) {
            pipeline.onTextMessage(live, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        LiveSession live = liveSession(session);
        if (live != null) {
            pipeline.close(live, "connection closed (" + status.getCode() + ")");
        }
    }

    private static LiveSession liveSession(WebSocketSession session) {
        return (LiveSession) session.getAttributes().get(LIVE_SESSION_ATTRIBUTE);
    }

    private record WebSocketSink(WebSocketSession session) implements SessionSink {
        @Override
        public void send(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
