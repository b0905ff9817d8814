package com.phillippitts.interviewcopilot.presentation.websocket;

import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityHandshakeInterceptorTest {

    private final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
    private final Map<String, Object> attributes = new HashMap<>();

    @Test
    void headerIdentityWins() {
        MockHttpServletRequest request = upgradeRequest();
        request.addHeader("X-User-ID", " alice ");
        request.setQueryString("user_id=bob");

        boolean accepted = handshake(new IdentityHandshakeInterceptor(SessionProperties.defaults()), request);

        assertThat(accepted).isTrue();
        assertThat(attributes).containsEntry(IdentityHandshakeInterceptor.USER_ID_ATTRIBUTE, "alice");
    }

    @Test
    void fallsBackToQueryParameter() {
        MockHttpServletRequest request = upgradeRequest();
        request.setQueryString("user_id=bob");

        handshake(new IdentityHandshakeInterceptor(SessionProperties.defaults()), request);

        assertThat(attributes).containsEntry(IdentityHandshakeInterceptor.USER_ID_ATTRIBUTE, "bob");
    }

    @Test
    void runsAnonymouslyWhenIdentityIsOptional() {
        boolean accepted = handshake(new IdentityHandshakeInterceptor(SessionProperties.defaults()), upgradeRequest());

        assertThat(accepted).isTrue();
        assertThat(attributes).containsEntry(IdentityHandshakeInterceptor.USER_ID_ATTRIBUTE, "anonymous");
    }

    @Test
    void rejectsMissingIdentityWhenRequired() {
        IdentityHandshakeInterceptor interceptor =
                new IdentityHandshakeInterceptor(new SessionProperties("/ws/session", "*", 100, true));

        boolean accepted = handshake(interceptor, upgradeRequest());

        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
    }

    private boolean handshake(IdentityHandshakeInterceptor interceptor, MockHttpServletRequest request) {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse), null, attributes);
    }

    private static MockHttpServletRequest upgradeRequest() {
        return new MockHttpServletRequest("GET", "/ws/session");
    }
}
