package com.phillippitts.convocapture.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLogContextTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void bindAndClearManageSessionKeys() {
        ThreadContext.put("other", "kept");

        SessionLogContext.bind("s-1", 42L);
        assertThat(ThreadContext.get(SessionLogContext.SESSION_ID)).isEqualTo("s-1");
        assertThat(ThreadContext.get(SessionLogContext.CONVERSATION_ID)).isEqualTo("42");

        SessionLogContext.clear();
        assertThat(ThreadContext.containsKey(SessionLogContext.SESSION_ID)).isFalse();
        assertThat(ThreadContext.containsKey(SessionLogContext.CONVERSATION_ID)).isFalse();
        assertThat(ThreadContext.get("other")).isEqualTo("kept");
    }

    @Test
    void daemonThreadsCarryCreatorContext() throws Exception {
        SessionLogContext.bind("s-2", 7L);
        ThreadFactory factory = SessionLogContext.daemonThreadFactory("session-s-2-pipeline");
        SessionLogContext.clear();

        AtomicReference<Map<String, String>> seen = new AtomicReference<>();
        Thread first = factory.newThread(() -> seen.set(ThreadContext.getImmutableContext()));
        Thread second = factory.newThread(() -> { });

        assertThat(first.isDaemon()).isTrue();
        assertThat(first.getName()).isEqualTo("session-s-2-pipeline-1");
        assertThat(second.getName()).isEqualTo("session-s-2-pipeline-2");

        first.start();
        first.join(2000);
        assertThat(seen.get())
                .containsEntry(SessionLogContext.SESSION_ID, "s-2")
                .containsEntry(SessionLogContext.CONVERSATION_ID, "7");
    }
}
