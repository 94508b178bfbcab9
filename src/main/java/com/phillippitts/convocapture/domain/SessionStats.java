package com.phillippitts.convocapture.domain;

import java.util.Objects;

/**
 * Immutable snapshot of a session's public statistics, as returned by the session manager.
 *
 * @param sessionId           opaque session token
 * @param userId              owning user
 * @param partnerId           conversation partner
 * @param conversationId      persisted conversation this session writes to
 * @param running             whether audio is still being captured and streamed
 * @param state               lifecycle state at the time of the snapshot
 * @param elapsedSeconds      seconds since the session started (0 before start)
 * @param elapsedFormatted    {@code elapsedSeconds} as {@code HH:MM:SS}
 * @param messageCount        messages persisted so far
 * @param transcriptCount     entries currently held in the recent-transcript ring
 * @param detectedPartnerName partner name detected from the transcript, or null
 * @param chunksEnqueued      audio frames handed over by the capture callback
 * @param chunksSent          audio frames forwarded to the transcription service
 */
public record SessionStats(
        String sessionId,
        long userId,
        long partnerId,
        long conversationId,
        boolean running,
        SessionState state,
        double elapsedSeconds,
        String elapsedFormatted,
        int messageCount,
        int transcriptCount,
        String detectedPartnerName,
        long chunksEnqueued,
        long chunksSent
) {

    public SessionStats {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(elapsedFormatted, "elapsedFormatted must not be null");
    }
}
