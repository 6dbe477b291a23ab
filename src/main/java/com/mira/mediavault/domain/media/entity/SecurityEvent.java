package com.mira.mediavault.domain.media.entity;

import com.mira.mediavault.domain.media.enums.SecurityEventType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Append-only audit record for protected media.
 * Media is referenced by id only so events outlive any cleanup of the media row.
 */
@Entity
@Immutable
@Table(name = "media_security_events", indexes = {
    @Index(name = "idx_security_event_media", columnList = "media_id, created_at"),
    @Index(name = "idx_security_event_media_actor_type", columnList = "media_id, actor_id, event_type"),
    @Index(name = "idx_security_event_conversation", columnList = "conversation_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class SecurityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false)
    private Long conversationId;

    @Column(name = "media_id", nullable = false, updatable = false)
    private Long mediaId;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 30, nullable = false, updatable = false)
    private SecurityEventType eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
