package com.demo.chathub.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted chat message. {@code threadId} and {@code replyToId} hold internal keys of other
 * messages in the same chat and are null when the client reference could not be resolved.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_public_id", columnList = "public_id", unique = true),
    @Index(name = "idx_messages_chat_created", columnList = "chat_id,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "public_id", nullable = false, length = 64)
    private String publicId;

    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MessageRole role;

    @Column(length = 100)
    private String model;

    @Column(name = "message_type", nullable = false, length = 20)
    private String messageType;

    @Column(name = "thread_id")
    private Long threadId;

    @Column(name = "reply_to_id")
    private Long replyToId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (messageType == null) {
            messageType = "text";
        }
    }
}
