package com.phillippitts.interviewcopilot.service.metrics;

import com.phillippitts.interviewcopilot.domain.Grounding;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for live sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Sessions opened and closed</li>
 *   <li>Questions detected per type, and finalize signals that produced none</li>
 *   <li>Answers delivered per grounding level and source, with generation latency</li>
 *   <li>Generation failures per reason code</li>
 *   <li>Recognition gaps per kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "copilot.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void sessionOpened() {
        Counter.builder(METRIC_PREFIX + ".opened")
                .description("Number of live sessions opened")
                .register(registry)
                .increment();
    }

    public void sessionClosed() {
        Counter.builder(METRIC_PREFIX + ".closed")
                .description("Number of live sessions closed")
                .register(registry)
                .increment();
    }

    /**
     * @param questionType wire name of the question type
     */
    public void questionDetected(String questionType) {
        Counter.builder(METRIC_PREFIX + ".questions")
                .description("Number of questions detected at a boundary")
                .tag("type", questionType)
                .register(registry)
                .increment();
    }

    public void boundaryWithoutQuestion() {
        Counter.builder(METRIC_PREFIX + ".boundaries.empty")
                .description("Number of finalize signals that produced no question")
                .register(registry)
                .increment();
    }

    /**
     * Records a delivered answer.
     *
     * @param grounding grounding level of the answer
     * @param source generated or uploaded
     * @param durationNanos time from dispatch to completion
     */
    public void answerDelivered(Grounding grounding, String source, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".answers")
                .description("Number of answers delivered")
                .tag("grounding", grounding.name().toLowerCase())
                .tag("source", source)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".generation.latency")
                .description("Time from answer dispatch to completion")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason failure reason code (GENERATION_FAILED, GENERATION_TIMEOUT)
     */
    public void generationFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".generation.failures")
                .description("Number of failed answer generations")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param kind gap kind (gap, out_of_order)
     */
    public void recognitionGap(String kind) {
        Counter.builder(METRIC_PREFIX + ".recognition.gaps")
                .description("Number of audio sequence gaps or reorderings")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
