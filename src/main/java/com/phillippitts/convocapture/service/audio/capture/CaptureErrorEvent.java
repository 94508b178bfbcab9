package com.phillippitts.convocapture.service.audio.capture;

import java.time.Instant;

/**
 * Published when a microphone cannot be opened or fails while capturing.
 *
 * Payload contains a short reason, the device hint and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(String reason, String device, Instant at) { }
