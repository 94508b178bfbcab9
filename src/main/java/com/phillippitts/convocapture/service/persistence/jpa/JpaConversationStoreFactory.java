package com.phillippitts.convocapture.service.persistence.jpa;

import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import com.phillippitts.convocapture.service.persistence.ConversationStoreFactory;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens one application-managed {@code EntityManager} per store handle, so every session owns
 * its persistence context outright.
 */
@Component
public class JpaConversationStoreFactory implements ConversationStoreFactory {

    private final EntityManagerFactory emf;

    public JpaConversationStoreFactory(EntityManagerFactory emf) {
        this.emf = emf;
    }

    @Override
    public ConversationStore open() {
        try {
            return new JpaConversationStore(emf.createEntityManager());
        } catch (RuntimeException e) {
            throw new ConversationPersistenceException("open store", e);
        }
    }
}
