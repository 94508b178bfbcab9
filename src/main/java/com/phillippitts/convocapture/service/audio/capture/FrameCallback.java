package com.phillippitts.convocapture.service.audio.capture;

/**
 * Receives raw PCM frames from a microphone's driver thread.
 *
 * <p>Invoked on the audio driver thread: implementations must not block and must not do I/O.
 */
@FunctionalInterface
public interface FrameCallback {

    void onFrame(byte[] frame);
}
