package com.phillippitts.convocapture.exception;

/**
 * Thrown when a conversation, message, or partner record cannot be read or written.
 *
 * <p>During session creation this aborts the creation. While a session is running it is
 * logged and the failed write is skipped.
 */
public class ConversationPersistenceException extends ConvoCaptureException {

    private final String operation;

    public ConversationPersistenceException(String operation, Throwable cause) {
        super("Persistence operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
