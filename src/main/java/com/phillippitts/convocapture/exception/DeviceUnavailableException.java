package com.phillippitts.convocapture.exception;

/**
 * Thrown when the microphone cannot be acquired (no device, line busy, or access denied).
 * A session that hits this never reaches the running state and never connects to the
 * transcription service.
 */
public class DeviceUnavailableException extends ConvoCaptureException {

    public static final String MIC_UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";

    private final String reason;

    public DeviceUnavailableException(String reason, String message, Throwable cause) {
        super("Microphone unavailable (" + reason + "): " + message, cause);
        this.reason = reason;
    }

    /** Short reason code, one of {@link #MIC_UNAVAILABLE} or {@link #MIC_PERMISSION_DENIED}. */
    public String getReason() {
        return reason;
    }
}
