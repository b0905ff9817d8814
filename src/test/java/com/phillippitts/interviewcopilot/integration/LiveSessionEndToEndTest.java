package com.phillippitts.interviewcopilot.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.interviewcopilot.client.session.SessionConfig;
import com.phillippitts.interviewcopilot.client.transport.TransportEvent;
import com.phillippitts.interviewcopilot.client.transport.WebSocketSessionTransport;
import com.phillippitts.interviewcopilot.config.properties.TransportProperties;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.protocol.EnvelopeCodec;
import com.phillippitts.interviewcopilot.protocol.Payloads;
import com.phillippitts.interviewcopilot.service.session.SessionRegistry;
import com.phillippitts.interviewcopilot.testutil.TestProfiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives a real server session over a loopback WebSocket with the client transport. Speech
 * recognition is disabled, so questions arrive through {@code request_answer}.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveSessionEndToEndTest {

    @LocalServerPort
    private int port;

    @Autowired
    private SessionRegistry registry;

    private final List<TransportEvent> events = new CopyOnWriteArrayList<>();
    private WebSocketSessionTransport transport;

    @BeforeEach
    void setUp() {
        transport = new WebSocketSessionTransport(new TransportProperties(50, 200, 2.0, 2),
                new EnvelopeCodec(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        transport.close().orTimeout(5, TimeUnit.SECONDS).join();
    }

    @Test
    void explicitQuestionIsAnsweredFromTheMatchingStory() {
        connect("alice");
        transport.sendContext(TestProfiles.stories());

        transport.requestAnswer("Tell me about a time you handled conflict on your team", QuestionType.BEHAVIORAL);

        Payloads.Answer answer = awaitAnswer();
        assertThat(answer.grounding()).isEqualTo("STORIES");
        assertThat(answer.storyIds()).containsExactly(TestProfiles.CONFLICT.id());
        assertThat(answer.answer()).isNotBlank();

        TransportEvent.QuestionDetected detected = events.stream()
                .filter(TransportEvent.QuestionDetected.class::isInstance)
                .map(TransportEvent.QuestionDetected.class::cast)
                .findFirst().orElseThrow();
        assertThat(detected.questionId()).isEqualTo(answer.questionId());
        assertThat(detected.type()).isEqualTo(QuestionType.BEHAVIORAL);
    }

    @Test
    void sessionIsRegisteredForItsUserAndRemovedOnClose() {
        connect("bob");

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(registry.all()).anyMatch(s -> s.userId().equals("bob")));

        transport.close().orTimeout(5, TimeUnit.SECONDS).join();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(registry.all()).noneMatch(s -> s.userId().equals("bob")));
    }

    @Test
    void answersWithoutContextAreMarkedUngrounded() {
        connect("carol");

        transport.requestAnswer("Why do you want to work here?", null);

        Payloads.Answer answer = awaitAnswer();
        assertThat(answer.grounded()).isFalse();
        assertThat(answer.grounding()).isEqualTo("NONE");
    }

    private void connect(String userId) {
        SessionConfig config = new SessionConfig(URI.create("ws://localhost:" + port + "/ws/session"), userId, "en");
        transport.connect(config, events::add).orTimeout(5, TimeUnit.SECONDS).join();
    }

    private Payloads.Answer awaitAnswer() {
        await().atMost(Duration.ofSeconds(10)).until(() -> firstAnswer().isPresent());
        return firstAnswer().orElseThrow();
    }

    private Optional<Payloads.Answer> firstAnswer() {
        return events.stream()
                .filter(TransportEvent.AnswerReady.class::isInstance)
                .map(e -> ((TransportEvent.AnswerReady) e).answer())
                .findFirst();
    }
}
