/**
 * Streaming speech-to-text gateway.
 *
 * <p>A {@link com.phillippitts.convocapture.service.stt.TranscriptionClient} opens a
 * {@link com.phillippitts.convocapture.service.stt.TranscriptionConnection}: raw PCM frames go
 * out with {@code send}, {@link com.phillippitts.convocapture.service.stt.TranscriptEvent}s come
 * back through a blocking {@code receive}. The Deepgram live API is the only implementation.
 *
 * <p>All implementations:
 * <ul>
 *   <li>Accept audio in 16kHz, 16-bit PCM, mono format</li>
 *   <li>Allow one sender thread and one receiver thread per connection</li>
 *   <li>Release a blocked {@code receive} when the connection closes or fails</li>
 * </ul>
 *
 * @see com.phillippitts.convocapture.service.audio.AudioFormat
 * @since 1.0
 */
package com.phillippitts.convocapture.service.stt;
