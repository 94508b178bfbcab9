package com.phillippitts.convocapture.exception;

/**
 * Thrown when a session is created with an id that is already registered or being created.
 */
public class DuplicateSessionException extends ConvoCaptureException {

    private final String sessionId;

    public DuplicateSessionException(String sessionId) {
        super("Session already exists: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
