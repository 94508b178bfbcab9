package com.phillippitts.convocapture.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One finalized transcript fragment as held in a session's recent-transcript ring.
 *
 * @param timestamp      elapsed offset formatted as {@code HH:MM:SS}
 * @param elapsedSeconds elapsed offset since session start
 * @param text           fragment text as received
 * @param receivedAt     wall-clock time the fragment arrived
 */
public record TranscriptEntry(
        String timestamp,
        double elapsedSeconds,
        String text,
        Instant receivedAt
) {

    public TranscriptEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }
}
