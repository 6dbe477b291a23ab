package com.mira.mediavault.domain.media.entity;

import com.mira.mediavault.domain.media.enums.MediaReportReason;
import com.mira.mediavault.domain.media.enums.MediaReportStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A participant's complaint about a media item and the user behind it.
 * Reports are only taken in here; reviewing them happens elsewhere.
 */
@Entity
@Table(name = "media_reports", indexes = {
    @Index(name = "idx_media_report_media", columnList = "media_id"),
    @Index(name = "idx_media_report_status", columnList = "status, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MediaReport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(name = "media_id", nullable = false)
    private Long mediaId;

    @Column(name = "reporter_id", nullable = false)
    private Long reporterId;

    @Column(name = "reported_user_id", nullable = false)
    private Long reportedUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", length = 30, nullable = false)
    private MediaReportReason reason;

    @Column(name = "description", length = 1000)
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private MediaReportStatus status = MediaReportStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
