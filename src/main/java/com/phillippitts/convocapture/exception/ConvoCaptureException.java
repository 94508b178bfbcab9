package com.phillippitts.convocapture.exception;

/**
 * Base exception for all convocapture application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ConvoCaptureException extends RuntimeException {

    public ConvoCaptureException(String message) {
        super(message);
    }

    public ConvoCaptureException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConvoCaptureException(Throwable cause) {
        super(cause);
    }
}
