/**
 * Network boundary of the server: the session WebSocket endpoint and the REST API.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - Handshake identity, socket handler, endpoint registration</li>
 *   <li>{@code presentation.controller} - Read-only session and answer history endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Handlers are thin adapters: all session behaviour lives in
 * {@link com.phillippitts.interviewcopilot.service.session.SessionPipeline}.
 *
 * @since 1.0
 */
package com.phillippitts.interviewcopilot.presentation;
