package com.phillippitts.convocapture.service.transcript;

import com.phillippitts.convocapture.domain.MessageRecord;
import com.phillippitts.convocapture.domain.TranscriptEntry;
import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import com.phillippitts.convocapture.testutil.InMemoryConversationStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FinalTranscriptCompilerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Test
    void prefersBufferedLinesWhenAvailable() {
        TranscriptBuffer buffer = new TranscriptBuffer(20_000, 50, 100);
        buffer.append(new TranscriptEntry("00:00:01", 1.0, "hello", T0));
        ConversationStore store = mock(ConversationStore.class);

        FinalTranscriptCompiler compiler = FinalTranscriptCompiler.preferBuffered(
                new BufferedLinesStrategy(buffer), new PersistedMessagesStrategy(store, 7L));

        assertThat(compiler.compile()).isEqualTo("[00:00:01] hello");
        verify(store, never()).listMessages(anyLong());
    }

    @Test
    void fallsBackToPersistedMessagesOrderedByTime() {
        InMemoryConversationStore db = new InMemoryConversationStore();
        ConversationStore store = db.open();
        long conv = store.createConversation(1, 2, "Session s", T0);
        db.seedMessage(conv, "user", "second", T0.plusSeconds(5));
        db.seedMessage(conv, "user", "first", T0.plusSeconds(1));
        db.seedMessage(conv, null, "third", T0.plusSeconds(9));

        FinalTranscriptCompiler compiler = FinalTranscriptCompiler.preferBuffered(
                new BufferedLinesStrategy(new TranscriptBuffer(20_000, 50, 100)),
                new PersistedMessagesStrategy(store, conv));

        assertThat(compiler.compile()).isEqualTo(
                "2025-01-01T10:00:01Z [User]: first\n"
                        + "2025-01-01T10:00:05Z [User]: second\n"
                        + "2025-01-01T10:00:09Z [Speaker]: third");
    }

    @Test
    void persistedStrategyYieldsEmptyTranscriptWhenReadFails() {
        ConversationStore store = mock(ConversationStore.class);
        when(store.listMessages(3L)).thenThrow(
                new ConversationPersistenceException("list messages", new IllegalStateException("down")));

        assertThat(new PersistedMessagesStrategy(store, 3L).compile()).isEmpty();
    }

    @Test
    void emptyWhenNoStrategyApplies() {
        FinalTranscriptStrategy never = new FinalTranscriptStrategy() {
            @Override public String name() { return "never"; }
            @Override public boolean isApplicable() { return false; }
            @Override public String compile() { return "unexpected"; }
        };

        assertThat(new FinalTranscriptCompiler(List.of(never)).compile()).isEmpty();
    }

    @Test
    void formatCapitalizesSender() {
        MessageRecord m = new MessageRecord(1, 1, "PARTNER", "hi", T0);

        assertThat(PersistedMessagesStrategy.format(m)).isEqualTo("2025-01-01T10:00:00Z [Partner]: hi");
    }

    @Test
    void formatOmitsTimestampPrefixWhenMissing() {
        MessageRecord m = new MessageRecord(1, 1, "user", "hello", null);

        assertThat(PersistedMessagesStrategy.format(m)).isEqualTo("[User]: hello");
    }
}
