/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.InterviewCopilotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.DeviceUnavailableException} - microphone
 *       acquisition failed; fatal to capture, session stays connected</li>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.TransportDisconnectedException} - channel
 *       lost and reconnection exhausted</li>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.GenerationFailureException} - model or
 *       service error, with {@link com.phillippitts.interviewcopilot.exception.GenerationTimeoutException}
 *       as the timeout variant carrying its own reason code</li>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.InvalidAudioFrameException} and
 *       {@link com.phillippitts.interviewcopilot.exception.ProtocolException} - malformed input on
 *       the session channel</li>
 *   <li>{@link com.phillippitts.interviewcopilot.exception.SessionNotFoundException} - REST lookup of
 *       a closed or unknown session</li>
 * </ul>
 *
 * <p>Recognition gaps are not exceptions: dropped or reordered audio is reported as a
 * {@code RecognitionGapEvent} and never retried.
 *
 * @see com.phillippitts.interviewcopilot.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.interviewcopilot.exception;
