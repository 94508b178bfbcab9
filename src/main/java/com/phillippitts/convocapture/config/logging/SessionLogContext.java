package com.phillippitts.convocapture.config.logging;

import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Log4j2 {@link ThreadContext} keys that correlate log lines with a session, and helpers
 * that carry them onto the threads a session spawns.
 *
 * <p>The log pattern in {@code log4j2-spring.xml} prints {@code %X{sessionId}} and
 * {@code %X{conversationId}}.
 */
public final class SessionLogContext {

    public static final String SESSION_ID = "sessionId";
    public static final String CONVERSATION_ID = "conversationId";

    private SessionLogContext() {
        // Utility class - prevent instantiation
    }

    /** Puts the session keys on the current thread. */
    public static void bind(String sessionId, long conversationId) {
        ThreadContext.put(SESSION_ID, sessionId);
        ThreadContext.put(CONVERSATION_ID, Long.toString(conversationId));
    }

    /** Removes the session keys from the current thread. */
    public static void clear() {
        ThreadContext.remove(SESSION_ID);
        ThreadContext.remove(CONVERSATION_ID);
    }

    /**
     * Daemon thread factory named {@code <prefix>-N} whose threads inherit the context of the
     * thread that created the factory.
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Runnable withContext = () -> {
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                }
            };
            Thread t = new Thread(withContext, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
