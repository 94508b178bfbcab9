package com.phillippitts.convocapture.service.session;

import com.phillippitts.convocapture.domain.SessionState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateMachineTest {

    @Test
    void shouldFollowNormalLifecycle() {
        SessionStateMachine sm = new SessionStateMachine();

        assertThat(sm.current()).isEqualTo(SessionState.CREATED);
        assertThat(sm.advance(SessionState.STARTING)).isTrue();
        assertThat(sm.advance(SessionState.RUNNING)).isTrue();
        assertThat(sm.hasReachedRunning()).isTrue();
        assertThat(sm.advance(SessionState.STOPPING)).isTrue();
        assertThat(sm.advance(SessionState.STOPPED)).isTrue();
        assertThat(sm.isTerminal()).isTrue();
    }

    @Test
    void shouldRefuseTransitionsOutOfTerminalStates() {
        SessionStateMachine sm = new SessionStateMachine();
        sm.advance(SessionState.STARTING);
        sm.advance(SessionState.FAILED);

        for (SessionState target : SessionState.values()) {
            assertThat(sm.advance(target)).isFalse();
        }
        assertThat(sm.current()).isEqualTo(SessionState.FAILED);
        assertThat(sm.hasReachedRunning()).isFalse();
    }

    @Test
    void shouldRefuseSkippingStates() {
        SessionStateMachine sm = new SessionStateMachine();

        assertThat(sm.advance(SessionState.RUNNING)).isFalse();
        assertThat(sm.advance(SessionState.STOPPED)).isFalse();
        assertThat(sm.advance(SessionState.FAILED)).isFalse();
        assertThat(sm.current()).isEqualTo(SessionState.CREATED);
    }

    @Test
    void stopBeforeStartIsAllowed() {
        assertThat(SessionStateMachine.isAllowed(SessionState.CREATED, SessionState.STOPPING)).isTrue();
        assertThat(SessionStateMachine.isAllowed(SessionState.STARTING, SessionState.STOPPING)).isTrue();
        assertThat(SessionStateMachine.isAllowed(SessionState.STOPPING, SessionState.FAILED)).isFalse();
        assertThat(SessionStateMachine.isAllowed(SessionState.STOPPED, SessionState.STOPPING)).isFalse();
    }

    @Test
    void transitionRequiresExpectedState() {
        SessionStateMachine sm = new SessionStateMachine();

        assertThat(sm.transition(SessionState.STARTING, SessionState.RUNNING)).isFalse();
        assertThat(sm.transition(SessionState.CREATED, SessionState.STARTING)).isTrue();
        assertThat(sm.transition(SessionState.CREATED, SessionState.STARTING)).isFalse();
    }

    @Test
    void shouldRejectNullTarget() {
        assertThatThrownBy(() -> new SessionStateMachine().advance(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void onlyOneConcurrentTransitionWins() throws Exception {
        SessionStateMachine sm = new SessionStateMachine();
        sm.advance(SessionState.STARTING);
        sm.advance(SessionState.RUNNING);

        int threads = 8;
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Thread> workers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            SessionState target = i % 2 == 0 ? SessionState.STOPPING : SessionState.FAILED;
            Thread t = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (sm.advance(target)) {
                    winners.incrementAndGet();
                }
            });
            workers.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : workers) {
            t.join(1000);
        }

        assertThat(winners.get()).isEqualTo(1);
        assertThat(sm.current()).isIn(SessionState.STOPPING, SessionState.FAILED);
    }
}
