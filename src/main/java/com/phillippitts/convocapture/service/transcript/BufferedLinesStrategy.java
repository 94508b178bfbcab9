package com.phillippitts.convocapture.service.transcript;

/**
 * Compiles the final transcript from the lines the session buffered in memory.
 */
public final class BufferedLinesStrategy implements FinalTranscriptStrategy {

    private final TranscriptBuffer buffer;

    public BufferedLinesStrategy(TranscriptBuffer buffer) {
        this.buffer = buffer;
    }

    @Override
    public String name() {
        return "buffered-lines";
    }

    @Override
    public boolean isApplicable() {
        return !buffer.isEmpty();
    }

    @Override
    public String compile() {
        return buffer.compile();
    }
}
