package com.phillippitts.convocapture.service.persistence.jpa;

import com.phillippitts.convocapture.domain.MessageRecord;
import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the embedded database. Store handles manage their own transactions, so the
 * test-managed transaction is switched off.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(JpaConversationStoreFactory.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaConversationStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    @Autowired
    private JpaConversationStoreFactory factory;

    @Autowired
    private EntityManagerFactory emf;

    private ConversationStore store;

    @BeforeEach
    void setUp() {
        store = factory.open();
    }

    @AfterEach
    void tearDown() {
        store.close();
        EntityManager em = emf.createEntityManager();
        try {
            em.getTransaction().begin();
            em.createQuery("delete from MessageEntity").executeUpdate();
            em.createQuery("delete from ConversationEntity").executeUpdate();
            em.createQuery("delete from ConversationPartnerEntity").executeUpdate();
            em.getTransaction().commit();
        } finally {
            em.close();
        }
    }

    private long seedPartner(String name) {
        EntityManager em = emf.createEntityManager();
        try {
            em.getTransaction().begin();
            ConversationPartnerEntity p = new ConversationPartnerEntity(1L, name);
            em.persist(p);
            em.getTransaction().commit();
            return p.getId();
        } finally {
            em.close();
        }
    }

    private <T> T find(Class<T> type, long id) {
        EntityManager em = emf.createEntityManager();
        try {
            return em.find(type, id);
        } finally {
            em.close();
        }
    }

    @Test
    void shouldCreateOpenConversation() {
        long id = store.createConversation(1L, 2L, "Session abc", T0);

        ConversationEntity row = find(ConversationEntity.class, id);
        assertThat(row.getUserId()).isEqualTo(1L);
        assertThat(row.getPartnerId()).isEqualTo(2L);
        assertThat(row.getTitle()).isEqualTo("Session abc");
        assertThat(row.getStartedAt()).isEqualTo(T0);
        assertThat(row.getEndedAt()).isNull();
        assertThat(row.isAnalyzed()).isFalse();
    }

    @Test
    void shouldListMessagesByTimestamp() {
        long id = store.createConversation(1L, 2L, "Session abc", T0);
        store.appendMessage(id, "user", "second", T0.plusSeconds(2));
        store.appendMessage(id, "user", "first", T0.plusSeconds(1));
        store.appendMessage(id, "user", "also second", T0.plusSeconds(2));
        long other = store.createConversation(1L, 2L, "Session other", T0);
        store.appendMessage(other, "user", "elsewhere", T0);

        List<MessageRecord> messages = store.listMessages(id);

        assertThat(messages).extracting(MessageRecord::content)
                .containsExactly("first", "second", "also second");
        assertThat(messages).allSatisfy(m -> assertThat(m.conversationId()).isEqualTo(id));
    }

    @Test
    void shouldStoreLongTranscript() {
        long id = store.createConversation(1L, 2L, "Session abc", T0);
        String transcript = "[00:00:01] hello\n".repeat(2_000);

        assertThat(store.updateConversation(id, T0.plusSeconds(60), transcript)).isTrue();

        ConversationEntity row = find(ConversationEntity.class, id);
        assertThat(row.getEndedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(row.getFullTranscript()).isEqualTo(transcript);
    }

    @Test
    void updateOfMissingConversationReturnsFalse() {
        assertThat(store.updateConversation(999_999L, T0, "x")).isFalse();
    }

    @Test
    void shouldRenamePartnerOnlyWhenNameDiffers() {
        long partnerId = seedPartner("Partner 1");

        assertThat(store.renamePartner(partnerId, "Sarah")).isTrue();
        assertThat(store.renamePartner(partnerId, "SARAH")).isFalse();
        assertThat(store.renamePartner(999_999L, "Sarah")).isFalse();

        ConversationPartnerEntity row = find(ConversationPartnerEntity.class, partnerId);
        assertThat(row.getName()).isEqualTo("Sarah");
        assertThat(row.getUpdatedAt()).isNotNull();
    }

    @Test
    void closedStoreRejectsOperations() {
        store.close();
        store.close();

        assertThatThrownBy(() -> store.createConversation(1L, 2L, "late", T0))
                .isInstanceOf(ConversationPersistenceException.class)
                .extracting(e -> ((ConversationPersistenceException) e).getOperation())
                .isEqualTo("create conversation");
    }

    @Test
    void handlesAreIndependent() {
        long id = store.createConversation(1L, 2L, "Session abc", T0);
        try (ConversationStore second = factory.open()) {
            second.appendMessage(id, "user", "from another handle", T0);
        }

        assertThat(store.listMessages(id)).extracting(MessageRecord::content)
                .containsExactly("from another handle");
    }
}
