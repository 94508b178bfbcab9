package com.phillippitts.convocapture.service.stt;

/**
 * One event received from the transcription service.
 *
 * @param type       event type as sent by the service (may be empty)
 * @param finalized  whether the fragment is final and will not be revised
 * @param transcript fragment text (may be empty)
 */
public record TranscriptEvent(String type, boolean finalized, String transcript) {

    public TranscriptEvent {
        type = type == null ? "" : type;
        transcript = transcript == null ? "" : transcript;
    }

    /** Whether this event carries finalized, non-blank transcript text. */
    public boolean hasFinalText() {
        return finalized && !transcript.isBlank();
    }
}
