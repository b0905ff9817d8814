package com.phillippitts.interviewcopilot.config.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.interviewcopilot.client.ClientRunner;
import com.phillippitts.interviewcopilot.client.audio.AudioCaptureEngine;
import com.phillippitts.interviewcopilot.client.audio.JavaSoundAudioCaptureEngine;
import com.phillippitts.interviewcopilot.client.profile.JsonFileProfileLookup;
import com.phillippitts.interviewcopilot.client.profile.ProfileLookup;
import com.phillippitts.interviewcopilot.client.session.LiveSessionCoordinator;
import com.phillippitts.interviewcopilot.client.transport.SessionTransport;
import com.phillippitts.interviewcopilot.client.transport.WebSocketSessionTransport;
import com.phillippitts.interviewcopilot.config.properties.AudioCaptureProperties;
import com.phillippitts.interviewcopilot.config.properties.ClientProperties;
import com.phillippitts.interviewcopilot.config.properties.TransportProperties;
import com.phillippitts.interviewcopilot.protocol.EnvelopeCodec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires the console client. Only active with {@code copilot.client.enabled=true}; the server
 * role never touches the microphone.
 */
@Configuration
@ConditionalOnProperty(prefix = "copilot.client", name = "enabled", havingValue = "true")
public class ClientConfig {

    @Bean
    public AudioCaptureEngine audioCaptureEngine(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        return new JavaSoundAudioCaptureEngine(props, publisher);
    }

    @Bean(destroyMethod = "shutdown")
    public SessionTransport sessionTransport(TransportProperties props, EnvelopeCodec codec) {
        return new WebSocketSessionTransport(props, codec);
    }

    @Bean
    public ProfileLookup profileLookup(ClientProperties props, ObjectMapper objectMapper) {
        return new JsonFileProfileLookup(Path.of(props.profilePath()), objectMapper);
    }

    @Bean
    public LiveSessionCoordinator liveSessionCoordinator(AudioCaptureEngine capture,
                                                         SessionTransport transport,
                                                         ProfileLookup profiles,
                                                         @Qualifier("sessionExecutor") Executor executor) {
        return new LiveSessionCoordinator(capture, transport, profiles, executor);
    }

    @Bean
    public ClientRunner clientRunner(LiveSessionCoordinator coordinator, ClientProperties props) {
        return new ClientRunner(coordinator, props);
    }
}
