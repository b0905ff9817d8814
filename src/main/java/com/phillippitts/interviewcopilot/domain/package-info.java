/**
 * Domain models for a live interview session.
 *
 * <p>All domain models are immutable records that validate or normalise their fields in the
 * compact constructor, so {@code null} collections and strings never leak into the pipeline.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.interviewcopilot.domain.AudioChunk} - fixed-duration PCM slice
 *       with a sequence number; never retained after recognition</li>
 *   <li>{@link com.phillippitts.interviewcopilot.domain.ContextPayload} - resume text, STAR
 *       stories, talking points and prepared Q&amp;A pairs for one generation baseline</li>
 *   <li>{@link com.phillippitts.interviewcopilot.domain.TranscriptState} - current segment and
 *       accumulated text since the last boundary</li>
 *   <li>{@link com.phillippitts.interviewcopilot.domain.QuestionEvent} - one detected question
 *       per finalize</li>
 *   <li>{@link com.phillippitts.interviewcopilot.domain.AnswerRecord} - append-only suggested
 *       answer with its grounding</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.interviewcopilot.domain;
