package com.phillippitts.convocapture.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for conversation sessions.
 *
 * <p>Metrics (prefix {@code convocapture.session}):
 * <ul>
 *   <li>{@code started}, {@code stopped}, {@code failed} (tagged by reason)</li>
 *   <li>{@code messages.persisted}, {@code persistence.failures} (tagged by operation)</li>
 *   <li>{@code audio.chunks.sent}</li>
 *   <li>{@code active} gauge of registered sessions</li>
 * </ul>
 *
 * <p>A {@code null} registry turns every method into a no-op, see {@link #NOOP}.
 */
@Component
public class SessionMetrics {

    private static final Logger LOG = LogManager.getLogger(SessionMetrics.class);

    private static final String METRIC_PREFIX = "convocapture.session";

    /** No-op instance for tests and standalone wiring. */
    public static final SessionMetrics NOOP = new SessionMetrics(null);

    private final MeterRegistry registry;
    private final AtomicInteger active = new AtomicInteger();

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
        if (registry == null) {
            LOG.debug("SessionMetrics created without registry (test mode)");
            return;
        }
        Gauge.builder(METRIC_PREFIX + ".active", active, AtomicInteger::get)
                .description("Sessions currently registered with the manager")
                .register(registry);
    }

    public void sessionStarted() {
        increment("started", "Sessions created successfully");
    }

    public void sessionStopped() {
        increment("stopped", "Sessions stopped and removed from the registry");
    }

    /**
     * @param reason short failure code, e.g. a device reason or exception simple name
     */
    public void sessionFailed(String reason) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".failed")
                .description("Sessions that failed to start")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void messagePersisted() {
        increment("messages.persisted", "Transcript messages persisted");
    }

    /**
     * @param operation persistence operation that failed, e.g. {@code append message}
     */
    public void persistenceFailure(String operation) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".persistence.failures")
                .description("Persistence operations that failed during a session")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void audioChunkSent() {
        increment("audio.chunks.sent", "Audio frames forwarded to the transcription service");
    }

    /** Updates the active-sessions gauge. */
    public void activeSessions(int count) {
        active.set(count);
    }

    private void increment(String name, String description) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .register(registry)
                .increment();
    }
}
