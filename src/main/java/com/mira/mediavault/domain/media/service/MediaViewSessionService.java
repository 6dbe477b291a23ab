package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.AccessDenialReason;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.model.MediaInfo;
import com.mira.mediavault.domain.media.model.MediaOpenResult;
import com.mira.mediavault.domain.media.model.MediaViewGrant;
import com.mira.mediavault.exception.UnauthorizedActionException;
import com.mira.mediavault.integration.conversation.ConversationDirectory;
import com.mira.mediavault.integration.storage.MediaStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * View Session Controller
 *
 * <p>Per-recipient state machine over a protected media item:
 * UNOPENED -> OPEN (timer running or unbounded) -> CLOSED, with REVOKED reachable from any state
 * and overriding everything. All session state lives on the permission row; nothing is kept in memory.
 *
 * <p>The owner path never reads or writes permission rows, so an owner can not lock themselves out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaViewSessionService {

    private static final DateTimeFormatter WATERMARK_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String UNKNOWN_VIEWER = "Unknown";

    private final MediaRegistryService registryService;
    private final MediaPermissionService permissionService;
    private final SecurityEventService securityEventService;
    private final MediaSystemMessagePublisher systemMessagePublisher;
    private final MediaStorageService storageService;
    private final ConversationDirectory conversationDirectory;
    private final Clock clock;

    @Value("${media.locator.ttl-seconds:300}")
    private long locatorTtlSeconds;

    /**
     * Open a media item for viewing. A recipient's view is counted and, on the first open,
     * the timer starts. The permission row stays locked until commit, so concurrent opens
     * of the same row run one after the other and see each other's view count.
     */
    @Transactional
    public MediaOpenResult open(Long mediaId, Long viewerId) {
        ProtectedMedia media = registryService.get(mediaId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (media.isDeleted()) {
            return deny(media, viewerId, AccessDenialReason.DELETED);
        }

        if (media.isOwnedBy(viewerId)) {
            return MediaOpenResult.granted(MediaViewGrant.builder()
                    .mediaId(media.getId())
                    .locator(storageService.createLocator(media.getObjectKey(), Duration.ofSeconds(locatorTtlSeconds)))
                    .allowScreenshot(true)
                    .shouldBlur(false)
                    .viewOnce(media.isViewOnce())
                    .timerSeconds(media.getTimerSeconds())
                    .owner(true)
                    .build());
        }

        Optional<MediaPermission> found = permissionService.lockForRecipient(mediaId, viewerId);
        if (found.isEmpty() || !found.get().isCanView()) {
            return deny(media, viewerId, AccessDenialReason.NO_PERMISSION);
        }

        MediaPermission permission = found.get();
        if (permission.isRevoked()) {
            return deny(media, viewerId, AccessDenialReason.REVOKED);
        }
        if (permission.isExpiredAt(now)) {
            return deny(media, viewerId, AccessDenialReason.EXPIRED);
        }
        if (media.isViewOnce() && permission.getViewCount() >= 1) {
            return deny(media, viewerId, AccessDenialReason.VIEW_ONCE_CONSUMED);
        }

        permissionService.recordView(permission, media, now);

        boolean allowScreenshot = permission.isScreenshotAllowedAt(now);
        String watermarkText = media.isWatermarkEnabled() ? buildWatermark(viewerId, now) : null;

        securityEventService.append(media, viewerId, SecurityEventType.MEDIA_OPENED,
                Map.of("viewCount", permission.getViewCount()));

        log.info("[MediaViewSession] Media {} opened by {} (viewCount={}, expiresAt={})",
                mediaId, viewerId, permission.getViewCount(), permission.getExpiresAt());

        return MediaOpenResult.granted(MediaViewGrant.builder()
                .mediaId(media.getId())
                .locator(storageService.createLocator(media.getObjectKey(), locatorTtl(now, permission.getExpiresAt())))
                .allowScreenshot(allowScreenshot)
                .shouldBlur(!allowScreenshot)
                .watermarkText(watermarkText)
                .expiresAt(permission.getExpiresAt())
                .viewOnce(media.isViewOnce())
                .timerSeconds(media.getTimerSeconds())
                .owner(false)
                .viewCount(permission.getViewCount())
                .build());
    }

    /**
     * Explicit expiry trigger. Revokes every recipient of the media, records the expiry,
     * and burns ephemeral media. A repeated close changes nothing and records nothing.
     */
    @Transactional
    public boolean close(Long mediaId, Long actorId) {
        return close(mediaId, actorId, Map.of());
    }

    /**
     * @param metadata extra audit metadata describing what triggered the close
     * @return false if the media was already closed
     */
    @Transactional
    public boolean close(Long mediaId, Long actorId, Map<String, Object> metadata) {
        ProtectedMedia media = registryService.getForUpdate(mediaId);

        if (!media.isOwnedBy(actorId)
                && !conversationDirectory.isParticipant(media.getConversationId(), actorId)) {
            log.warn("[MediaViewSession] Non-participant {} tried to close media {}", actorId, mediaId);
            throw new UnauthorizedActionException("Not a participant of this conversation");
        }

        int revokedCount = permissionService.revokeAll(mediaId);
        if (revokedCount == 0 && securityEventService.hasEvent(mediaId, SecurityEventType.MEDIA_EXPIRED)) {
            log.debug("[MediaViewSession] Media {} already closed, ignoring close by {}", mediaId, actorId);
            return false;
        }

        Map<String, Object> eventMetadata = new LinkedHashMap<>(metadata);
        eventMetadata.put("revokedCount", revokedCount);
        securityEventService.append(media, actorId, SecurityEventType.MEDIA_EXPIRED, eventMetadata);
        systemMessagePublisher.publish(media, actorId, SecurityEventType.MEDIA_EXPIRED, "Media expired");

        if (media.isEphemeral()) {
            registryService.softDelete(media);
        }

        log.info("[MediaViewSession] Media {} closed by {} ({} permissions revoked, burned={})",
                mediaId, actorId, revokedCount, media.isDeleted());
        return true;
    }

    /**
     * Read-only status for one user. Does not count a view.
     */
    @Transactional(readOnly = true)
    public MediaInfo describe(Long mediaId, Long userId) {
        ProtectedMedia media = registryService.get(mediaId);
        LocalDateTime now = LocalDateTime.now(clock);

        MediaInfo.MediaInfoBuilder info = MediaInfo.builder()
                .mediaId(media.getId())
                .kind(media.getKind())
                .timerSeconds(media.getTimerSeconds())
                .viewOnce(media.isViewOnce())
                .watermarkEnabled(media.isWatermarkEnabled());

        if (media.isOwnedBy(userId)) {
            return info.owner(true)
                    .canScreenshot(true)
                    .expired(media.isDeleted())
                    .build();
        }

        MediaPermission permission = permissionService.findOptional(mediaId, userId)
                .orElseThrow(() -> new UnauthorizedActionException("No access to this media"));

        boolean expired = media.isDeleted()
                || permission.isRevoked()
                || !permission.isCanView()
                || permission.isExpiredAt(now)
                || (media.isViewOnce() && permission.getViewCount() >= 1);

        return info.owner(false)
                .canScreenshot(permission.isScreenshotAllowedAt(now))
                .expired(expired)
                .build();
    }

    private MediaOpenResult deny(ProtectedMedia media, Long viewerId, AccessDenialReason reason) {
        log.debug("[MediaViewSession] Open of media {} by {} denied: {}", media.getId(), viewerId, reason.getCode());
        return MediaOpenResult.denied(reason);
    }

    private String buildWatermark(Long viewerId, LocalDateTime now) {
        String viewerName = conversationDirectory.findDisplayName(viewerId).orElse(UNKNOWN_VIEWER);
        return viewerName + " · " + WATERMARK_FORMAT.format(now);
    }

    /**
     * Locators never outlive the viewer's access window.
     */
    private Duration locatorTtl(LocalDateTime now, LocalDateTime expiresAt) {
        Duration ttl = Duration.ofSeconds(locatorTtlSeconds);
        if (expiresAt == null) {
            return ttl;
        }
        Duration remaining = Duration.between(now, expiresAt);
        if (remaining.compareTo(Duration.ofSeconds(1)) < 0) {
            return Duration.ofSeconds(1);
        }
        return remaining.compareTo(ttl) < 0 ? remaining : ttl;
    }
}
