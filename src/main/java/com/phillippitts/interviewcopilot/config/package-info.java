/**
 * Application-wide configuration beans and properties.
 *
 * <p>Spring configuration classes that define beans and load externalized configuration from
 * {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.interviewcopilot.config.AudioFormatConfig} - Wire audio format
 *       constants and their startup validation (16kHz, 16-bit, mono PCM)</li>
 *   <li>{@link com.phillippitts.interviewcopilot.config.ThreadPoolConfig} - Session and
 *       generation executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.interviewcopilot.config.ThreadPoolMetricsConfig} - Pool gauges
 *       and periodic health logging</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.client} - Console client wiring (opt-in)</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.interviewcopilot.config;
