package com.phillippitts.convocapture.service.persistence.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * A captured conversation. {@code endedAt} and {@code fullTranscript} are written once,
 * when the owning session stops.
 */
@Entity
@Table(name = "conversations")
public class ConversationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private long userId;

    @Column(name = "partner_id", nullable = false)
    private long partnerId;

    @Column(name = "title")
    private String title;

    @Column(name = "is_analyzed", nullable = false)
    private boolean analyzed;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "full_transcript", columnDefinition = "TEXT")
    private String fullTranscript;

    protected ConversationEntity() {
        // JPA
    }

    public ConversationEntity(long userId, long partnerId, String title, Instant startedAt) {
        this.userId = userId;
        this.partnerId = partnerId;
        this.title = title;
        this.startedAt = startedAt;
        this.analyzed = false;
    }

    public Long getId() { return id; }

    public long getUserId() { return userId; }

    public long getPartnerId() { return partnerId; }

    public String getTitle() { return title; }

    public boolean isAnalyzed() { return analyzed; }
    public void setAnalyzed(boolean analyzed) { this.analyzed = analyzed; }

    public Instant getStartedAt() { return startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public String getFullTranscript() { return fullTranscript; }
    public void setFullTranscript(String fullTranscript) { this.fullTranscript = fullTranscript; }
}
