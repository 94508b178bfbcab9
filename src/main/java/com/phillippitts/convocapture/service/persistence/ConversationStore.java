package com.phillippitts.convocapture.service.persistence;

import com.phillippitts.convocapture.domain.MessageRecord;

import java.time.Instant;
import java.util.List;

/**
 * Persistence handle owned by exactly one session.
 *
 * <p>Handles are never shared between sessions. Every method throws
 * {@link com.phillippitts.convocapture.exception.ConversationPersistenceException} when the
 * underlying write or read fails; callers decide whether that is fatal.
 */
public interface ConversationStore extends AutoCloseable {

    /**
     * Creates a conversation row with {@code started_at} set and {@code ended_at} null.
     *
     * @return the new conversation id
     */
    long createConversation(long userId, long partnerId, String title, Instant startedAt);

    /** Appends one message to the conversation. */
    void appendMessage(long conversationId, String sender, String content, Instant timestamp);

    /**
     * Sets the end time and the compiled transcript.
     *
     * @return {@code false} if the conversation does not exist
     */
    boolean updateConversation(long conversationId, Instant endedAt, String fullTranscript);

    /** All messages of the conversation ordered by timestamp ascending. */
    List<MessageRecord> listMessages(long conversationId);

    /**
     * Renames the conversation partner unless the stored name already matches,
     * ignoring case.
     *
     * @return {@code true} if the name was changed, {@code false} if it already matched or
     *         the partner does not exist
     */
    boolean renamePartner(long partnerId, String name);

    /** Releases the handle. Idempotent. */
    @Override
    void close();
}
