/**
 * Logging infrastructure.
 *
 * <p>MDC keys used across the application:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - HTTP requests ({@link com.phillippitts.interviewcopilot.config.logging.MdcFilter})</li>
 *   <li>{@code userId} - handshake identity, on HTTP requests and all session work</li>
 *   <li>{@code sessionId} - live session id, applied by each session's ordered queue</li>
 * </ul>
 *
 * <p>Worker threads inherit the submitting thread's context through the executor task decorator
 * in {@link com.phillippitts.interviewcopilot.config.ThreadPoolConfig}.
 */
package com.phillippitts.interviewcopilot.config.logging;
