package com.phillippitts.interviewcopilot.presentation.websocket;

import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import com.phillippitts.interviewcopilot.service.session.SessionPipeline;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the live session endpoint at {@code copilot.session.endpoint-path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // One second of 16 kHz PCM16 mono plus header, with room for larger chunk settings
    private static final int MAX_BINARY_MESSAGE_BYTES = 512 * 1024;
    private static final int MAX_TEXT_MESSAGE_BYTES = 1024 * 1024;

    private final SessionProperties props;
    private final SessionPipeline pipeline;

    public WebSocketConfig(SessionProperties props, SessionPipeline pipeline) {
        this.props = props;
        this.pipeline = pipeline;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(sessionWebSocketHandler(), props.endpointPath())
                .addInterceptors(new IdentityHandshakeInterceptor(props))
                .setAllowedOriginPatterns(props.allowedOrigins().split("\\s*,\\s*"));
    }

    @Bean
    public SessionWebSocketHandler sessionWebSocketHandler() {
        return new SessionWebSocketHandler(pipeline);
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(MAX_BINARY_MESSAGE_BYTES);
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        return container;
    }
}
