package com.phillippitts.convocapture.service.transcript;

/**
 * One way of producing a session's final transcript when it stops.
 *
 * <p>Strategies are tried in order by {@link FinalTranscriptCompiler}; the first one whose
 * {@link #isApplicable()} returns true produces the transcript.
 */
public interface FinalTranscriptStrategy {

    /** Short name used in log lines. */
    String name();

    /** Whether this strategy has data to work with. */
    boolean isApplicable();

    /** Compiles the transcript; never null. */
    String compile();
}
