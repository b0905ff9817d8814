package com.phillippitts.interviewcopilot.service.events;

import java.time.Instant;

/**
 * Published when an answer generation fails or times out. Carries no question or answer text.
 *
 * @param reason GENERATION_FAILED or GENERATION_TIMEOUT
 */
public record GenerationFailedEvent(String sessionId, String questionId, String reason, Instant at) { }
