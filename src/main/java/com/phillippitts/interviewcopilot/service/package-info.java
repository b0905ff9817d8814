/**
 * Server-side services of the live session pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.session} - Session lifecycle, ordered inbound queue, envelope dispatch</li>
 *   <li>{@code service.recognition} - Speech recognizer boundary (Vosk, no-op)</li>
 *   <li>{@code service.transcript} - Transcript accumulation and audio sequence monitoring</li>
 *   <li>{@code service.detection} - Question boundary detection and classification</li>
 *   <li>{@code service.generation} - Story selection, prompt assembly and answer generation</li>
 *   <li>{@code service.context} - Per-session context baseline</li>
 *   <li>{@code service.events} - Typed event channels and throttled error logging</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer meters and health</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Per-session state is confined to the session's queue; shared beans are stateless</li>
 *   <li>Services throw domain exceptions, never transport-specific ones</li>
 *   <li>Services use constructor injection</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.interviewcopilot.service;
