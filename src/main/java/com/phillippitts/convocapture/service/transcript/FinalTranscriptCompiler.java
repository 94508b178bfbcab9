package com.phillippitts.convocapture.service.transcript;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Selects the first applicable {@link FinalTranscriptStrategy} and compiles with it.
 */
public final class FinalTranscriptCompiler {

    private static final Logger LOG = LogManager.getLogger(FinalTranscriptCompiler.class);

    private final List<FinalTranscriptStrategy> strategies;

    public FinalTranscriptCompiler(List<FinalTranscriptStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Buffered lines first, persisted messages as the fallback.
     */
    public static FinalTranscriptCompiler preferBuffered(BufferedLinesStrategy buffered,
                                                         PersistedMessagesStrategy persisted) {
        return new FinalTranscriptCompiler(List.of(buffered, persisted));
    }

    /**
     * @return the compiled transcript, or an empty string if no strategy applies
     */
    public String compile() {
        for (FinalTranscriptStrategy s : strategies) {
            if (s.isApplicable()) {
                String transcript = s.compile();
                LOG.debug("Final transcript compiled by {} ({} chars)", s.name(), transcript.length());
                return transcript;
            }
        }
        LOG.debug("No transcript strategy applicable; final transcript is empty");
        return "";
    }
}
