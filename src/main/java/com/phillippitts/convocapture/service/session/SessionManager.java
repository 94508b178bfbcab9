package com.phillippitts.convocapture.service.session;

import com.phillippitts.convocapture.config.logging.SessionLogContext;
import com.phillippitts.convocapture.config.properties.SessionProperties;
import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import com.phillippitts.convocapture.domain.RecentTranscripts;
import com.phillippitts.convocapture.domain.SessionState;
import com.phillippitts.convocapture.domain.SessionStats;
import com.phillippitts.convocapture.exception.ConfigurationException;
import com.phillippitts.convocapture.exception.DeviceUnavailableException;
import com.phillippitts.convocapture.exception.DuplicateSessionException;
import com.phillippitts.convocapture.service.metrics.SessionMetrics;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of live conversation sessions and their synchronous control surface.
 *
 * <p>Each session runs on its own daemon thread named {@code session-<id>}. A session is
 * visible in the registry from the moment its start-up wait completes until its stop has
 * finished (thread joined or join timed out).
 *
 * <p><b>Thread Safety:</b> registry mutation is serialized by a single {@link ReentrantLock}.
 * Ids being created are reserved in a pending set so a concurrent duplicate create fails
 * fast without holding the lock across the start-up wait. Listing copies the registry under
 * the lock and builds statistics outside it.
 *
 * <p>Errors: a missing credential, a duplicate id, a persistence failure while creating the
 * conversation, or an unavailable microphone fail {@link #create}. Unknown ids are reported as
 * empty results, never thrown.
 */
@Service
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    static final String CREDENTIAL_SETTING = "transcription.api-key";

    private final ConversationSessionFactory sessionFactory;
    private final SessionProperties props;
    private final TranscriptionProperties transcriptionProps;
    private final SessionMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private final Map<String, Entry> sessions = new LinkedHashMap<>();
    private final Set<String> pending = new HashSet<>();

    public SessionManager(ConversationSessionFactory sessionFactory,
                          SessionProperties props,
                          TranscriptionProperties transcriptionProps,
                          SessionMetrics metrics) {
        this.sessionFactory = sessionFactory;
        this.props = props;
        this.transcriptionProps = transcriptionProps;
        this.metrics = metrics == null ? SessionMetrics.NOOP : metrics;
    }

    /**
     * Creates the conversation record, starts a session on its own thread and registers it
     * once the microphone reports active or the start-up wait elapses.
     *
     * @param credential transcription credential; blank falls back to the configured key
     * @return statistics of the newly registered session
     * @throws ConfigurationException if no credential is available
     * @throws DuplicateSessionException if the id is registered or being created
     * @throws com.phillippitts.convocapture.exception.ConversationPersistenceException if the
     *         conversation cannot be created; no thread is started
     * @throws DeviceUnavailableException if the microphone cannot be opened
     */
    public SessionStats create(String sessionId, long userId, long partnerId, String credential) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        String resolved = resolveCredential(credential);
        reserve(sessionId);

        boolean registered = false;
        try {
            ConversationSession session = newSession(sessionId, userId, partnerId, resolved);
            long conversationId = session.getConversationId();

            Thread thread = new Thread(session, "session-" + sessionId);
            thread.setDaemon(true);
            thread.start();
            LOG.info("Session {} started on thread {} (conversation {})", sessionId, thread.getName(), conversationId);

            SessionState state = awaitStartup(session);
            Throwable cause = session.getFailureCause();
            if (state == SessionState.FAILED && cause instanceof DeviceUnavailableException) {
                DeviceUnavailableException deviceError = (DeviceUnavailableException) cause;
                join(thread, Duration.ofMillis(props.getStopJoinTimeoutMs()));
                metrics.sessionFailed(deviceError.getReason());
                throw deviceError;
            }
            if (state == SessionState.FAILED) {
                metrics.sessionFailed(cause == null ? "unknown" : cause.getClass().getSimpleName());
                LOG.warn("Session {} failed during start-up: {}; registering for inspection",
                        sessionId, cause == null ? "unknown" : cause.getMessage());
            } else if (state == SessionState.CREATED || state == SessionState.STARTING) {
                LOG.warn("Microphone not confirmed active within {}ms for session {}; registering anyway",
                        props.getStartupWaitMs(), sessionId);
            }

            lock.lock();
            try {
                pending.remove(sessionId);
                sessions.put(sessionId, new Entry(session, thread));
                registered = true;
                metrics.activeSessions(sessions.size());
            } finally {
                lock.unlock();
            }
            if (state != SessionState.FAILED) {
                metrics.sessionStarted();
            }
            return session.stats();
        } finally {
            if (!registered) {
                release(sessionId);
            }
        }
    }

    /**
     * @return statistics of the session, or empty if not registered
     */
    public Optional<SessionStats> get(String sessionId) {
        return find(sessionId).map(e -> e.session.stats());
    }

    /**
     * Statistics of every registered session, in creation order.
     */
    public List<SessionStats> list() {
        List<ConversationSession> snapshot = new ArrayList<>();
        lock.lock();
        try {
            for (Entry e : sessions.values()) {
                snapshot.add(e.session);
            }
        } finally {
            lock.unlock();
        }
        List<SessionStats> stats = new ArrayList<>(snapshot.size());
        for (ConversationSession s : snapshot) {
            stats.add(s.stats());
        }
        return stats;
    }

    /**
     * @param limit maximum number of entries to return
     * @return the most recent finalized fragments, or empty if the session is not registered
     */
    public Optional<RecentTranscripts> recentTranscripts(String sessionId, int limit) {
        return find(sessionId).map(e -> e.session.recentTranscripts(limit));
    }

    /**
     * Stops the session, joins its thread with a bounded wait and removes it from the registry.
     *
     * @return {@code true} if the session was found and stopped, {@code false} if it is unknown
     *         or another caller is already stopping it
     */
    public boolean stop(String sessionId) {
        return stopAndReport(sessionId).isPresent();
    }

    /**
     * Same as {@link #stop}, returning the session's statistics taken once the stop has
     * finished, so they include fragments persisted while the stream was closing.
     *
     * @return final statistics, or empty if the session is unknown or already being stopped
     */
    public Optional<SessionStats> stopAndReport(String sessionId) {
        Entry entry = find(sessionId).orElse(null);
        if (entry == null || !entry.stopClaimed.compareAndSet(false, true)) {
            LOG.debug("Stop requested for unknown session {}", sessionId);
            return Optional.empty();
        }

        SessionLogContext.bind(sessionId, entry.session.getConversationId());
        try {
            entry.session.stop();
        } catch (RuntimeException e) {
            LOG.error("Error while stopping session {}", sessionId, e);
        } finally {
            SessionLogContext.clear();
            join(entry.thread, Duration.ofMillis(props.getStopJoinTimeoutMs()));
            lock.lock();
            try {
                sessions.remove(sessionId);
                metrics.activeSessions(sessions.size());
            } finally {
                lock.unlock();
            }
            metrics.sessionStopped();
        }
        LOG.info("Session {} stopped and removed", sessionId);
        return Optional.of(entry.session.stats());
    }

    /**
     * Stops every registered session. A failure stopping one does not prevent the others.
     *
     * @return number of sessions stopped
     */
    public int stopAll() {
        List<String> ids;
        lock.lock();
        try {
            ids = new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
        int stopped = 0;
        for (String id : ids) {
            try {
                if (stop(id)) {
                    stopped++;
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to stop session {}", id, e);
            }
        }
        if (!ids.isEmpty()) {
            LOG.info("Stopped {} of {} sessions", stopped, ids.size());
        }
        return stopped;
    }

    /** Number of registered sessions. */
    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        LOG.info("Shutting down session manager");
        stopAll();
    }

    private String resolveCredential(String credential) {
        if (credential != null && !credential.isBlank()) {
            return credential;
        }
        String configured = transcriptionProps.getApiKey();
        if (configured == null || configured.isBlank()) {
            throw new ConfigurationException(CREDENTIAL_SETTING);
        }
        return configured;
    }

    private void reserve(String sessionId) {
        lock.lock();
        try {
            if (sessions.containsKey(sessionId) || !pending.add(sessionId)) {
                throw new DuplicateSessionException(sessionId);
            }
        } finally {
            lock.unlock();
        }
    }

    private void release(String sessionId) {
        lock.lock();
        try {
            pending.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the session's store handle before inserting the conversation row, so a failure to
     * open leaves no row behind. The handle is closed here only if no session takes it over.
     */
    private ConversationSession newSession(String sessionId, long userId, long partnerId, String credential) {
        ConversationStore store = sessionFactory.storeFactory().open();
        try {
            long conversationId = store.createConversation(userId, partnerId, "Session " + sessionId, Instant.now());
            return sessionFactory.create(sessionId, userId, partnerId, conversationId, credential, store);
        } catch (RuntimeException e) {
            try {
                store.close();
            } catch (RuntimeException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private SessionState awaitStartup(ConversationSession session) {
        try {
            return session.awaitStartup(Duration.ofMillis(props.getStartupWaitMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return session.getState();
        }
    }

    private Optional<Entry> find(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    private static void join(Thread thread, Duration timeout) {
        if (thread == Thread.currentThread() || timeout.toMillis() <= 0) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOG.warn("Thread {} did not terminate within {}ms", thread.getName(), timeout.toMillis());
        }
    }

    private static final class Entry {
        private final ConversationSession session;
        private final Thread thread;
        private final AtomicBoolean stopClaimed = new AtomicBoolean(false);

        private Entry(ConversationSession session, Thread thread) {
            this.session = session;
            this.thread = thread;
        }
    }
}
