package com.phillippitts.interviewcopilot.service.detection;

import com.phillippitts.interviewcopilot.domain.QuestionEvent;

import java.util.Optional;

/**
 * Decides whether a frozen transcript snapshot contains an interviewer question.
 *
 * <p>Contract:
 * <ul>
 *   <li>Called exactly once per finalize; the decision is one-shot, never streamed</li>
 *   <li>Empty or filler-only snapshots yield {@link Optional#empty()}</li>
 *   <li>Non-trivial question snapshots yield exactly one {@link QuestionEvent}</li>
 *   <li>Implementations must be stateless or thread-safe; sessions call concurrently</li>
 * </ul>
 */
public interface QuestionBoundaryDetector {

    Optional<QuestionEvent> detect(String snapshot);
}
