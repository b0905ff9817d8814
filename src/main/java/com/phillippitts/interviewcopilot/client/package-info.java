/**
 * Headless client role: microphone capture, the session transport and the client state machine.
 *
 * <p>Only wired when {@code copilot.client.enabled=true} (see
 * {@link com.phillippitts.interviewcopilot.config.client.ClientConfig}).
 */
package com.phillippitts.interviewcopilot.client;
