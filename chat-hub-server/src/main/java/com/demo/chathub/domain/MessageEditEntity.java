package com.demo.chathub.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one content change. Written before the message row is updated.
 */
@Entity
@Table(name = "message_edits", indexes = {
    @Index(name = "idx_message_edits_message_id", columnList = "message_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "edited_by_user_id", nullable = false)
    private Long editedByUserId;

    @Column(name = "old_content", nullable = false, columnDefinition = "TEXT")
    private String oldContent;

    @Column(name = "new_content", nullable = false, columnDefinition = "TEXT")
    private String newContent;

    @Column(name = "edited_at", nullable = false, updatable = false)
    private Instant editedAt;
}
