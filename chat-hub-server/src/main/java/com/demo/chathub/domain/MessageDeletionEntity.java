package com.demo.chathub.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of a removed message. Outlives the message row, so {@code messageId}
 * is a plain key with no foreign key constraint.
 */
@Entity
@Table(name = "message_deletions", indexes = {
    @Index(name = "idx_message_deletions_message_id", columnList = "message_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDeletionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "message_public_id", length = 64)
    private String messagePublicId;

    @Column(name = "deleted_by_user_id", nullable = false)
    private Long deletedByUserId;

    @Column(name = "old_content", columnDefinition = "TEXT")
    private String oldContent;

    @Column(length = 255)
    private String reason;

    @Column(name = "deleted_at", nullable = false, updatable = false)
    private Instant deletedAt;
}
