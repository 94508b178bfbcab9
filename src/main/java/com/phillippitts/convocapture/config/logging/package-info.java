/**
 * Log correlation for session threads.
 *
 * <p>Every thread working on behalf of a session (the session thread, its pipeline workers and
 * the microphone driver thread) carries the {@code sessionId} and {@code conversationId}
 * ThreadContext keys from
 * {@link com.phillippitts.convocapture.config.logging.SessionLogContext}.
 */
package com.phillippitts.convocapture.config.logging;
