package com.phillippitts.interviewcopilot.exception;

/**
 * Thrown when the microphone cannot be acquired: no input device, line busy, or permission denied.
 * Fatal to capture only; the session transport stays connected.
 */
public class DeviceUnavailableException extends InterviewCopilotException {

    public static final String MIC_UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";

    private final String reason;

    public DeviceUnavailableException(String reason, String message, Throwable cause) {
        super("Microphone unavailable (" + reason + "): " + message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
