package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.ScreenshotMode;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.repository.MediaPermissionRepository;
import com.mira.mediavault.exception.BusinessException;
import com.mira.mediavault.exception.DuplicateResourceException;
import com.mira.mediavault.exception.ResourceNotFoundException;
import com.mira.mediavault.exception.UnauthorizedActionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Permission Matrix
 * One access row per (media, recipient). Every mutation of a permission row goes through here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaPermissionService {

    private final MediaPermissionRepository permissionRepository;
    private final MediaRegistryService registryService;
    private final SecurityEventService securityEventService;
    private final MediaSystemMessagePublisher systemMessagePublisher;
    private final Clock clock;

    @Value("${media.screenshot.timed-grant-minutes:10}")
    private long timedGrantMinutes;

    @Transactional
    public MediaPermission createPermission(ProtectedMedia media, Long senderId, Long recipientId) {
        if (media.isOwnedBy(recipientId)) {
            throw new BusinessException("The media owner cannot be a recipient");
        }
        if (permissionRepository.existsByMediaIdAndRecipientId(media.getId(), recipientId)) {
            throw new DuplicateResourceException(
                    "Permission already exists for media " + media.getId() + " and recipient " + recipientId);
        }

        MediaPermission permission = MediaPermission.builder()
                .media(media)
                .senderId(senderId)
                .recipientId(recipientId)
                .createdAt(LocalDateTime.now(clock))
                .build();

        try {
            return permissionRepository.saveAndFlush(permission);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent insert of the same pair
            throw new DuplicateResourceException(
                    "Permission already exists for media " + media.getId() + " and recipient " + recipientId);
        }
    }

    @Transactional(readOnly = true)
    public MediaPermission find(Long mediaId, Long recipientId) {
        return findOptional(mediaId, recipientId)
                .orElseThrow(() -> new ResourceNotFoundException("MediaPermission",
                        "media=" + mediaId + ", recipient=" + recipientId));
    }

    @Transactional(readOnly = true)
    public Optional<MediaPermission> findOptional(Long mediaId, Long recipientId) {
        return permissionRepository.findByMediaIdAndRecipientId(mediaId, recipientId);
    }

    /**
     * Load the row with a write lock held until the surrounding transaction ends.
     */
    @Transactional
    public Optional<MediaPermission> lockForRecipient(Long mediaId, Long recipientId) {
        return permissionRepository.findForUpdate(mediaId, recipientId);
    }

    /**
     * Count one view. The caller must hold the row lock from {@link #lockForRecipient}.
     */
    @Transactional
    public MediaPermission recordView(MediaPermission permission, ProtectedMedia media, LocalDateTime now) {
        permission.recordView(now, media.getTimerSeconds());
        return permissionRepository.save(permission);
    }

    /**
     * Owner-only screenshot control for one recipient.
     * OFF clears the grant, ON grants without bound, ON_FOR_10_MIN grants until now + 10 minutes.
     */
    @Transactional
    public MediaPermission grantScreenshot(Long mediaId, Long recipientId, ScreenshotMode mode, Long actorId) {
        ProtectedMedia media = registryService.get(mediaId);

        if (!media.isOwnedBy(actorId)) {
            log.warn("[MediaPermission] User {} tried to change screenshot permission on media {}", actorId, mediaId);
            throw new UnauthorizedActionException("Only the media owner can change permissions");
        }

        MediaPermission permission = permissionRepository.findForUpdate(mediaId, recipientId)
                .orElseThrow(() -> new ResourceNotFoundException("MediaPermission",
                        "media=" + mediaId + ", recipient=" + recipientId));

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime allowedUntil = mode.isTimeBoxed() ? now.plusMinutes(timedGrantMinutes) : null;
        permission.applyScreenshotGrant(mode.allowsScreenshots(), allowedUntil);
        permissionRepository.save(permission);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("mode", mode.name());
        metadata.put("recipientId", recipientId);
        SecurityEventType eventType = mode.allowsScreenshots()
                ? SecurityEventType.PERMISSION_GRANTED
                : SecurityEventType.PERMISSION_REVOKED;
        securityEventService.append(media, actorId, eventType, metadata);
        systemMessagePublisher.publish(media, actorId, eventType, screenshotModeLabel(mode));

        log.info("[MediaPermission] Screenshot mode {} set on media {} for recipient {} (allowedUntil={})",
                mode, mediaId, recipientId, allowedUntil);
        return permission;
    }

    /**
     * Revoke one recipient. Idempotent.
     *
     * @return true if the row was revoked by this call
     */
    @Transactional
    public boolean revoke(Long mediaId, Long recipientId) {
        MediaPermission permission = permissionRepository.findForUpdate(mediaId, recipientId)
                .orElseThrow(() -> new ResourceNotFoundException("MediaPermission",
                        "media=" + mediaId + ", recipient=" + recipientId));

        boolean changed = permission.revoke();
        if (changed) {
            permissionRepository.save(permission);
        }
        return changed;
    }

    /**
     * Revoke every recipient of a media item. Already revoked rows are left as they are.
     * Rows are locked first, so an open still in flight commits its view before the row is revoked.
     *
     * @return number of rows revoked by this call
     */
    @Transactional
    public int revokeAll(Long mediaId) {
        List<MediaPermission> permissions = permissionRepository.findAllForUpdate(mediaId);
        int revoked = 0;
        for (MediaPermission permission : permissions) {
            if (permission.revoke()) {
                permissionRepository.save(permission);
                revoked++;
            }
        }
        return revoked;
    }

    /**
     * Owner-facing revocation of a single recipient's view access.
     *
     * @return true if the recipient still had access before this call
     */
    @Transactional
    public boolean revokeAccess(Long mediaId, Long recipientId, Long actorId) {
        ProtectedMedia media = registryService.get(mediaId);

        if (!media.isOwnedBy(actorId)) {
            log.warn("[MediaPermission] User {} tried to revoke access on media {}", actorId, mediaId);
            throw new UnauthorizedActionException("Only the media owner can revoke access");
        }

        boolean changed = revoke(mediaId, recipientId);
        if (changed) {
            securityEventService.append(media, actorId, SecurityEventType.ACCESS_REVOKED,
                    Map.of("recipientId", recipientId));
            systemMessagePublisher.publish(media, actorId, SecurityEventType.ACCESS_REVOKED, "Media access revoked");
            log.info("[MediaPermission] Access to media {} revoked for recipient {}", mediaId, recipientId);
        }
        return changed;
    }

    private String screenshotModeLabel(ScreenshotMode mode) {
        return switch (mode) {
            case OFF -> "Screenshot access revoked";
            case ON -> "Screenshot access granted";
            case ON_FOR_10_MIN -> "Screenshot access granted (" + timedGrantMinutes + " min)";
        };
    }
}
