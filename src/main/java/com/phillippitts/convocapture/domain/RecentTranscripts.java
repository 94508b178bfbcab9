package com.phillippitts.convocapture.domain;

import java.util.List;

/**
 * Result of a recent-transcripts lookup on a running session.
 *
 * @param sessionId           session queried
 * @param transcripts         most recent entries, oldest first
 * @param totalCount          entries currently held in the ring
 * @param detectedPartnerName partner name detected so far, or null
 */
public record RecentTranscripts(
        String sessionId,
        List<TranscriptEntry> transcripts,
        int totalCount,
        String detectedPartnerName
) {

    public RecentTranscripts {
        transcripts = List.copyOf(transcripts);
    }
}
