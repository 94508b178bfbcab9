package com.phillippitts.convocapture.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted transcript message as read back from the conversation store.
 *
 * @param id             store-assigned identifier
 * @param conversationId owning conversation
 * @param sender         capturing party (e.g. {@code user})
 * @param content        finalized fragment text
 * @param timestamp      when the fragment was persisted (may be null for legacy rows)
 */
public record MessageRecord(
        long id,
        long conversationId,
        String sender,
        String content,
        Instant timestamp
) {

    public MessageRecord {
        Objects.requireNonNull(content, "content must not be null");
    }
}
