package com.phillippitts.convocapture.service.persistence.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * One finalized transcript fragment. Rows are appended and never updated.
 */
@Entity
@Table(name = "messages", indexes = {
        @Index(name = "idx_messages_conversation", columnList = "conversation_id")
})
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private long conversationId;

    @Column(name = "sender", nullable = false)
    private String sender;

    @Column(name = "content", columnDefinition = "TEXT", nullable = false)
    private String content;

    @Column(name = "timestamp")
    private Instant timestamp;

    protected MessageEntity() {
        // JPA
    }

    public MessageEntity(long conversationId, String sender, String content, Instant timestamp) {
        this.conversationId = conversationId;
        this.sender = sender;
        this.content = content;
        this.timestamp = timestamp;
    }

    public Long getId() { return id; }

    public long getConversationId() { return conversationId; }

    public String getSender() { return sender; }

    public String getContent() { return content; }

    public Instant getTimestamp() { return timestamp; }
}
