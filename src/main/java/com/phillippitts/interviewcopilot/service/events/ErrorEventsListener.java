package com.phillippitts.interviewcopilot.service.events;

import com.phillippitts.interviewcopilot.client.audio.CaptureErrorEvent;
import com.phillippitts.interviewcopilot.service.transcript.RecognitionGapEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Operator-facing log lines for degraded sessions: lost microphone, dropped audio, failed answers.
 *
 * <p>A bursty failure (a flaky network dropping every other frame) would otherwise log once per
 * frame, so each distinct key logs at most once per {@link #THROTTLE}. Keys include the session id
 * where there is one, so one noisy session does not hide another.
 */
@Component
class ErrorEventsListener {

    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final ConcurrentMap<String, Instant> lastLogged = new ConcurrentHashMap<>();

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (!shouldLog("capture:" + e.reason() + ':' + e.phase())) {
            return;
        }
        if (e.phase() == CaptureErrorEvent.Phase.OPEN) {
            LOG.warn("Microphone '{}' could not be opened (reason={}); check the input device and OS permissions",
                    e.device(), e.reason());
        } else {
            LOG.warn("Microphone '{}' failed after {} chunk(s) (reason={}); restart capture once the device is back",
                    e.device(), e.chunksEmitted(), e.reason());
        }
    }

    @EventListener
    void onRecognitionGap(RecognitionGapEvent e) {
        if (!shouldLog("gap:" + e.sessionId() + ':' + e.kind())) {
            return;
        }
        if (e.kind() == RecognitionGapEvent.Kind.GAP) {
            LOG.warn("Session {} lost {} audio frame(s) (expected #{}, got #{}); transcript may have holes",
                    e.sessionId(), e.distance(), e.expectedSequence(), e.receivedSequence());
        } else {
            LOG.warn("Session {} received stale audio frame #{} (expected #{}); frame discarded",
                    e.sessionId(), e.receivedSequence(), e.expectedSequence());
        }
    }

    @EventListener
    void onGenerationFailed(GenerationFailedEvent e) {
        if (shouldLog("generation:" + e.sessionId() + ':' + e.reason())) {
            LOG.warn("No answer for question {} in session {} ({}); the user can retry with request_answer",
                    e.questionId(), e.sessionId(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        boolean[] due = {false};
        lastLogged.compute(key, (k, previous) -> {
            if (previous == null || Duration.between(previous, now).compareTo(THROTTLE) >= 0) {
                due[0] = true;
                return now;
            }
            return previous;
        });
        return due[0];
    }
}
