package com.phillippitts.convocapture.service.session;

import com.phillippitts.convocapture.domain.SessionState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle of one conversation session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED  → STARTING | STOPPING
 * STARTING → RUNNING | FAILED | STOPPING
 * RUNNING  → STOPPING | FAILED
 * STOPPING → STOPPED
 * </pre>
 * STOPPED and FAILED are terminal. Any other transition is refused, never thrown.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}.
 */
public final class SessionStateMachine {

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(SessionState.CREATED, EnumSet.of(SessionState.STARTING, SessionState.STOPPING));
        ALLOWED.put(SessionState.STARTING,
                EnumSet.of(SessionState.RUNNING, SessionState.FAILED, SessionState.STOPPING));
        ALLOWED.put(SessionState.RUNNING, EnumSet.of(SessionState.STOPPING, SessionState.FAILED));
        ALLOWED.put(SessionState.STOPPING, EnumSet.of(SessionState.STOPPED));
        ALLOWED.put(SessionState.STOPPED, EnumSet.noneOf(SessionState.class));
        ALLOWED.put(SessionState.FAILED, EnumSet.noneOf(SessionState.class));
    }

    private final Lock lock = new ReentrantLock();
    private SessionState state = SessionState.CREATED;
    private boolean reachedRunning;

    /**
     * Moves to {@code target} if the transition is allowed from the current state.
     *
     * @return {@code true} if the state changed
     * @throws NullPointerException if target is null
     */
    public boolean advance(SessionState target) {
        if (target == null) {
            throw new NullPointerException("target cannot be null");
        }
        lock.lock();
        try {
            if (!ALLOWED.get(state).contains(target)) {
                return false;
            }
            state = target;
            if (target == SessionState.RUNNING) {
                reachedRunning = true;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves from {@code expected} to {@code target} only if the current state is
     * {@code expected}.
     *
     * @return {@code true} if the state changed
     */
    public boolean transition(SessionState expected, SessionState target) {
        lock.lock();
        try {
            return state == expected && advance(target);
        } finally {
            lock.unlock();
        }
    }

    public SessionState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Whether the session has ever been in {@link SessionState#RUNNING}. */
    public boolean hasReachedRunning() {
        lock.lock();
        try {
            return reachedRunning;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return current().isTerminal();
    }

    /** Whether moving to {@code target} would be allowed from {@code from}. */
    static boolean isAllowed(SessionState from, SessionState target) {
        return ALLOWED.get(from).contains(target);
    }
}
