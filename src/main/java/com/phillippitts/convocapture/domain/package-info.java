/**
 * Immutable values exchanged with callers of the session manager.
 *
 * <p>All domain models are records or enums, self-validating, and independent of
 * persistence concerns (no JPA annotations). Internal handles such as sessions, threads or
 * connections never appear here.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.convocapture.domain.SessionStats} - public statistics of one session</li>
 *   <li>{@link com.phillippitts.convocapture.domain.SessionState} - session lifecycle</li>
 *   <li>{@link com.phillippitts.convocapture.domain.TranscriptEntry} - one recent fragment</li>
 *   <li>{@link com.phillippitts.convocapture.domain.MessageRecord} - one persisted message</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.convocapture.domain;
