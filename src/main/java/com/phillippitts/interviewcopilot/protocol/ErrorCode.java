package com.phillippitts.interviewcopilot.protocol;

/** Codes carried by {@code error} envelopes; each is a distinct user-visible condition. */
public enum ErrorCode {
    PROTOCOL_ERROR,
    INVALID_AUDIO,
    GENERATION_FAILED,
    GENERATION_TIMEOUT,
    DEVICE_UNAVAILABLE,
    TRANSPORT_DISCONNECTED,
    INTERNAL_ERROR;

    /** Lenient lookup; unknown codes map to {@link #INTERNAL_ERROR}. */
    public static ErrorCode fromWire(String value) {
        if (value == null) {
            return INTERNAL_ERROR;
        }
        try {
            return valueOf(value.trim());
        } catch (IllegalArgumentException e) {
            return INTERNAL_ERROR;
        }
    }
}
