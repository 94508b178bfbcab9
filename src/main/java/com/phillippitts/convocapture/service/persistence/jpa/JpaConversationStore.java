package com.phillippitts.convocapture.service.persistence.jpa;

import com.phillippitts.convocapture.domain.MessageRecord;
import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * {@link ConversationStore} backed by a private JPA {@link EntityManager}.
 *
 * <p>Each operation runs in its own resource-local transaction. The persistence context is
 * cleared after every operation so a long session does not accumulate managed entities.
 * Methods are synchronized: the receiver pipeline and the stopping thread may both touch the
 * handle, and an {@code EntityManager} is not thread-safe.
 */
final class JpaConversationStore implements ConversationStore {

    private static final Logger LOG = LogManager.getLogger(JpaConversationStore.class);

    private final EntityManager em;
    private boolean closed;

    JpaConversationStore(EntityManager em) {
        this.em = em;
    }

    @Override
    public synchronized long createConversation(long userId, long partnerId, String title, Instant startedAt) {
        return inTransaction("create conversation", em -> {
            ConversationEntity c = new ConversationEntity(userId, partnerId, title, startedAt);
            em.persist(c);
            em.flush();
            return c.getId();
        });
    }

    @Override
    public synchronized void appendMessage(long conversationId, String sender, String content, Instant timestamp) {
        inTransaction("append message", em -> {
            em.persist(new MessageEntity(conversationId, sender, content, timestamp));
            return null;
        });
    }

    @Override
    public synchronized boolean updateConversation(long conversationId, Instant endedAt, String fullTranscript) {
        return inTransaction("update conversation", em -> {
            ConversationEntity c = em.find(ConversationEntity.class, conversationId);
            if (c == null) {
                return false;
            }
            c.setEndedAt(endedAt);
            c.setFullTranscript(fullTranscript);
            return true;
        });
    }

    @Override
    public synchronized List<MessageRecord> listMessages(long conversationId) {
        return inTransaction("list messages", em -> em.createQuery(
                        "select m from MessageEntity m where m.conversationId = :cid "
                                + "order by m.timestamp asc, m.id asc", MessageEntity.class)
                .setParameter("cid", conversationId)
                .getResultList()
                .stream()
                .map(m -> new MessageRecord(m.getId(), m.getConversationId(), m.getSender(),
                        m.getContent(), m.getTimestamp()))
                .toList());
    }

    @Override
    public synchronized boolean renamePartner(long partnerId, String name) {
        return inTransaction("rename partner", em -> {
            ConversationPartnerEntity p = em.find(ConversationPartnerEntity.class, partnerId);
            if (p == null) {
                LOG.warn("Partner {} not found; detected name not stored", partnerId);
                return false;
            }
            if (p.getName() != null && p.getName().equalsIgnoreCase(name)) {
                return false;
            }
            p.setName(name);
            p.setUpdatedAt(Instant.now());
            return true;
        });
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            em.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing entity manager: {}", e.getMessage());
        }
    }

    private <T> T inTransaction(String operation, Function<EntityManager, T> work) {
        if (closed) {
            throw new ConversationPersistenceException(operation,
                    new IllegalStateException("store is closed"));
        }
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            T result = work.apply(em);
            tx.commit();
            return result;
        } catch (RuntimeException e) {
            rollbackQuietly(tx, operation);
            throw new ConversationPersistenceException(operation, e);
        } finally {
            em.clear();
        }
    }

    private static void rollbackQuietly(EntityTransaction tx, String operation) {
        try {
            if (tx.isActive()) {
                tx.rollback();
            }
        } catch (RuntimeException e) {
            LOG.warn("Rollback after failed '{}' also failed: {}", operation, e.getMessage());
        }
    }
}
