package com.phillippitts.convocapture.service.persistence.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * The person a user converses with. Only the name is maintained here; the rest of the
 * partner profile is managed elsewhere.
 */
@Entity
@Table(name = "conversation_partners")
public class ConversationPartnerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private long userId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected ConversationPartnerEntity() {
        // JPA
    }

    public ConversationPartnerEntity(long userId, String name) {
        this.userId = userId;
        this.name = name;
    }

    public Long getId() { return id; }

    public long getUserId() { return userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
