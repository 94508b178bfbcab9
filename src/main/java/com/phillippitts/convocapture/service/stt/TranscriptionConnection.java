package com.phillippitts.convocapture.service.stt;

/**
 * An open stream to the transcription service: audio frames go out, transcript events come in.
 *
 * <p>One thread sends and one thread receives. {@link #close()} may be called from any
 * thread and releases a receiver blocked in {@link #receive()}.
 */
public interface TranscriptionConnection extends AutoCloseable {

    /**
     * Sends one raw audio frame, blocking until it has been handed to the transport.
     *
     * @throws com.phillippitts.convocapture.exception.TranscriptionStreamException on failure
     *         or if the connection is closed
     */
    void send(byte[] frame);

    /**
     * Blocks until the next event arrives.
     *
     * @return the next event, or {@code null} once the stream has ended normally
     * @throws InterruptedException if interrupted while waiting
     * @throws com.phillippitts.convocapture.exception.TranscriptionStreamException if the
     *         stream ended with an error
     */
    TranscriptEvent receive() throws InterruptedException;

    /** Whether frames can still be sent and events received. */
    boolean isOpen();

    /** Closes the stream. Idempotent, best-effort, bounded in time. */
    @Override
    void close();
}
