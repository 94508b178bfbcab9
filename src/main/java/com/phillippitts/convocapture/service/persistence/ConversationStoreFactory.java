package com.phillippitts.convocapture.service.persistence;

/**
 * Opens a fresh {@link ConversationStore} handle. Each session opens its own.
 */
@FunctionalInterface
public interface ConversationStoreFactory {

    ConversationStore open();
}
