package com.mira.mediavault.domain.media.entity;

import com.mira.mediavault.domain.media.enums.MediaKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Canonical record of a protected media item shared inside a conversation.
 * The row is never removed: expiry clears the object key and stamps deletedAt
 * so the audit trail keeps pointing at something.
 */
@Entity
@Table(name = "protected_media", indexes = {
    @Index(name = "idx_protected_media_conversation", columnList = "conversation_id"),
    @Index(name = "idx_protected_media_owner", columnList = "owner_id"),
    @Index(name = "idx_protected_media_deleted_at", columnList = "deleted_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ProtectedMedia {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    /**
     * Opaque key into the blob store. Null once the media has been burned.
     */
    @Column(name = "object_key", length = 500)
    private String objectKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 10, nullable = false)
    private MediaKind kind;

    @Column(name = "timer_seconds")
    private Integer timerSeconds;

    @Builder.Default
    @Column(name = "view_once", nullable = false)
    private boolean viewOnce = false;

    @Builder.Default
    @Column(name = "watermark_enabled", nullable = false)
    private boolean watermarkEnabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId.equals(userId);
    }

    /**
     * Timer-bound or view-once media is burned on its terminal close.
     */
    public boolean isEphemeral() {
        return timerSeconds != null || viewOnce;
    }

    /**
     * Clears the object key and stamps the deletion time.
     *
     * @return the key that was cleared, or null if the media was already deleted
     */
    public String markDeleted(LocalDateTime now) {
        if (isDeleted()) {
            return null;
        }
        String previousKey = objectKey;
        objectKey = null;
        deletedAt = now;
        return previousKey;
    }
}
