package com.phillippitts.convocapture.service.audio.capture;

/**
 * An opened microphone input.
 *
 * Contract:
 * - {@link #start(FrameCallback)} is called at most once
 * - Frames are raw PCM (16kHz, 16-bit, mono, little-endian), delivered in capture order
 * - {@link #stop()} and {@link #close()} are idempotent and safe to call from any thread
 */
public interface Microphone extends AutoCloseable {

    /** Starts capture; frames are delivered to the callback on a dedicated driver thread. */
    void start(FrameCallback callback);

    /** Whether the device is open and delivering frames. */
    boolean isActive();

    /** Stops capture and waits briefly for the driver thread to finish. */
    void stop();

    /** Releases the device. */
    @Override
    void close();
}
