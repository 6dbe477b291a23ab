package com.mira.mediavault.domain.media.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Access-control row for one recipient of one protected media item.
 * The owner never has a row; owner access is implicit.
 */
@Entity
@Table(name = "media_permissions",
    uniqueConstraints = @UniqueConstraint(name = "uk_media_permission_recipient",
            columnNames = {"media_id", "recipient_id"}),
    indexes = {
        @Index(name = "idx_media_permission_recipient", columnList = "recipient_id")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MediaPermission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false)
    private ProtectedMedia media;

    @Column(name = "sender_id", nullable = false)
    private Long senderId;

    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Builder.Default
    @Column(name = "can_view", nullable = false)
    private boolean canView = true;

    @Builder.Default
    @Column(name = "can_screenshot", nullable = false)
    private boolean canScreenshot = false;

    @Builder.Default
    @Column(name = "revoked", nullable = false)
    private boolean revoked = false;

    @Builder.Default
    @Column(name = "view_count", nullable = false)
    private int viewCount = 0;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    /**
     * Upper bound of a time-boxed screenshot grant. Null means unbounded.
     */
    @Column(name = "allowed_until")
    private LocalDateTime allowedUntil;

    @Column(name = "last_viewed_at")
    private LocalDateTime lastViewedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isScreenshotAllowedAt(LocalDateTime now) {
        return canScreenshot && (allowedUntil == null || now.isBefore(allowedUntil));
    }

    /**
     * Records one successful view. The first view starts the timer; later views never re-arm it.
     */
    public void recordView(LocalDateTime now, Integer timerSeconds) {
        viewCount++;
        lastViewedAt = now;
        if (openedAt == null) {
            openedAt = now;
            if (timerSeconds != null) {
                expiresAt = now.plusSeconds(timerSeconds);
            }
        }
    }

    /**
     * @return true if this call flipped the row to revoked
     */
    public boolean revoke() {
        if (revoked) {
            return false;
        }
        revoked = true;
        return true;
    }

    public void applyScreenshotGrant(boolean canScreenshot, LocalDateTime allowedUntil) {
        this.canScreenshot = canScreenshot;
        this.allowedUntil = allowedUntil;
    }
}
