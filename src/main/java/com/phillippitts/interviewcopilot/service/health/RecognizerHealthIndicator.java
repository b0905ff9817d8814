package com.phillippitts.interviewcopilot.service.health;

import com.phillippitts.interviewcopilot.service.recognition.SpeechRecognizer;
import com.phillippitts.interviewcopilot.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech recognizer.
 *
 * <p>UP when the recognizer can open streams, DOWN otherwise (for example when the Vosk model
 * failed to load). Also reports the number of open sessions. Exposed via /actuator/health.
 */
@Component
public class RecognizerHealthIndicator implements HealthIndicator {

    private final SpeechRecognizer recognizer;
    private final SessionRegistry sessions;

    public RecognizerHealthIndicator(SpeechRecognizer recognizer, SessionRegistry sessions) {
        this.recognizer = recognizer;
        this.sessions = sessions;
    }

    @Override
    public Health health() {
        Health.Builder builder = recognizer.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("recognizer", recognizer.name())
                .withDetail("openSessions", sessions.size())
                .build();
    }
}
