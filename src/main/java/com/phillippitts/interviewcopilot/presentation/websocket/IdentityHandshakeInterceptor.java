package com.phillippitts.interviewcopilot.presentation.websocket;

import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Associates the connection with a user identity before the session is created.
 *
 * <p>Authentication is external: the identity provider (or a gateway in front of this service)
 * has already vouched for the user and forwards the id in the {@code X-User-ID} header. Local
 * clients that cannot set headers pass {@code user_id} as a query parameter instead.
 *
 * <p>With {@code copilot.session.require-identity=true} a handshake without an identity is
 * rejected with 401; otherwise the connection runs as {@value #ANONYMOUS}.
 */
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger LOG = LogManager.getLogger(IdentityHandshakeInterceptor.class);

    public static final String USER_ID_ATTRIBUTE = "copilot.userId";
    static final String USER_ID_HEADER = "X-User-ID";
    static final String USER_ID_PARAM = "user_id";
    static final String ANONYMOUS = "anonymous";

    private final boolean requireIdentity;

    public IdentityHandshakeInterceptor(SessionProperties props) {
        this.requireIdentity = props.requireIdentity();
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = request.getHeaders().getFirst(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            userId = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(USER_ID_PARAM);
        }
        if (userId == null || userId.isBlank()) {
            if (requireIdentity) {
                LOG.warn("Rejecting session handshake without user identity: remote={}", request.getRemoteAddress());
                response.setStatusCode(HttpStatus.UNAUTHORIZED);
                return false;
            }
            userId = ANONYMOUS;
        }
        attributes.put(USER_ID_ATTRIBUTE, userId.strip());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // no-op
    }
}
