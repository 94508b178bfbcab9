package com.phillippitts.convocapture.service.transcript;

import com.phillippitts.convocapture.domain.MessageRecord;
import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rebuilds the final transcript from the messages persisted for the conversation.
 *
 * <p>Used when nothing was buffered in memory. One line per message:
 * {@code <ISO-8601 timestamp> [<Sender>]: <content>}, without the timestamp
 * prefix when none was stored. A read failure yields an empty
 * transcript rather than failing the stop.
 */
public final class PersistedMessagesStrategy implements FinalTranscriptStrategy {

    private static final Logger LOG = LogManager.getLogger(PersistedMessagesStrategy.class);

    static final String UNKNOWN_SENDER = "Speaker";

    private final ConversationStore store;
    private final long conversationId;

    public PersistedMessagesStrategy(ConversationStore store, long conversationId) {
        this.store = store;
        this.conversationId = conversationId;
    }

    @Override
    public String name() {
        return "persisted-messages";
    }

    @Override
    public boolean isApplicable() {
        return store != null;
    }

    @Override
    public String compile() {
        List<MessageRecord> messages;
        try {
            messages = store.listMessages(conversationId);
        } catch (ConversationPersistenceException e) {
            LOG.warn("Could not read messages for conversation {}; final transcript left empty: {}",
                    conversationId, e.getMessage());
            return "";
        }
        return messages.stream()
                .map(PersistedMessagesStrategy::format)
                .collect(Collectors.joining("\n"));
    }

    static String format(MessageRecord m) {
        String line = "[" + capitalize(m.sender()) + "]: " + m.content();
        return m.timestamp() == null ? line : m.timestamp() + " " + line;
    }

    private static String capitalize(String sender) {
        if (sender == null || sender.isEmpty()) {
            return UNKNOWN_SENDER;
        }
        return sender.substring(0, 1).toUpperCase(Locale.ROOT) + sender.substring(1).toLowerCase(Locale.ROOT);
    }
}
