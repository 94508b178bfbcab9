package com.phillippitts.convocapture.exception;

/**
 * Thrown when the streaming connection to the transcription service fails to open,
 * or when sending or receiving on an open connection fails.
 */
public class TranscriptionStreamException extends ConvoCaptureException {

    private final String endpoint;

    public TranscriptionStreamException(String message, String endpoint) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public TranscriptionStreamException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
