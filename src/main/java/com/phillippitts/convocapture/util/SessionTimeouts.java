package com.phillippitts.convocapture.util;

import java.time.Duration;

/**
 * Fixed timeout values for thread and connection teardown inside a session.
 *
 * <p>The user-facing waits (create waiting for the microphone, stop waiting for the session
 * thread) are configurable through {@code session.*} properties. These are the internal
 * ones that bound each individual teardown step.
 *
 * @see com.phillippitts.convocapture.service.audio.capture.JavaSoundMicrophone
 * @see com.phillippitts.convocapture.service.session.ConversationSession
 * @since 1.0
 */
public final class SessionTimeouts {

    /**
     * Timeout for the microphone driver thread to terminate after the line is stopped.
     *
     * <p>A stopped {@code TargetDataLine} returns from a pending read promptly; 1000ms covers
     * a full default chunk (500ms) plus scheduling slack.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the sender and receiver pipelines to finish once the session is stopping.
     */
    public static final Duration PIPELINE_SHUTDOWN_TIMEOUT = Duration.ofMillis(2000);

    private SessionTimeouts() {
        // Utility class - prevent instantiation
    }
}
