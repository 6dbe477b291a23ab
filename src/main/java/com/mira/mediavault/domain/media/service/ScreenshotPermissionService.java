package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.ScreenshotMode;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.exception.UnauthorizedActionException;
import com.mira.mediavault.integration.conversation.ConversationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Screenshot Permission Manager
 * Owner control over screenshot rights, recipient access requests, and screenshot reports
 * coming from the device-level screenshot hook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreenshotPermissionService {

    private final MediaRegistryService registryService;
    private final MediaPermissionService permissionService;
    private final SecurityEventService securityEventService;
    private final MediaSystemMessagePublisher systemMessagePublisher;
    private final ConversationDirectory conversationDirectory;

    @Transactional
    public MediaPermission setScreenshotPermission(Long mediaId, Long recipientId, ScreenshotMode mode, Long actorId) {
        return permissionService.grantScreenshot(mediaId, recipientId, mode, actorId);
    }

    /**
     * A recipient asks the owner for screenshot rights. No permission bit changes.
     */
    @Transactional
    public void requestAccess(Long mediaId, Long requesterId) {
        ProtectedMedia media = registryService.get(mediaId);

        if (media.isOwnedBy(requesterId)) {
            throw new UnauthorizedActionException("Owner cannot request access to own media");
        }
        if (!conversationDirectory.isParticipant(media.getConversationId(), requesterId)) {
            log.warn("[ScreenshotPermission] Non-participant {} requested access to media {}", requesterId, mediaId);
            throw new UnauthorizedActionException("Not a participant of this conversation");
        }

        securityEventService.append(media, requesterId, SecurityEventType.ACCESS_REQUESTED, null);

        String name = conversationDirectory.findDisplayName(requesterId).orElse("Someone");
        systemMessagePublisher.publish(media, requesterId, SecurityEventType.ACCESS_REQUESTED,
                name + " requested screenshot access");
    }

    /**
     * Record a screenshot reported by the device. Every report is audited, but the conversation
     * only hears about the first one per (media, actor): devices are known to fire the hook twice.
     * The media row lock makes the lookup and the write one atomic step.
     */
    @Transactional
    public void reportScreenshotTaken(Long mediaId, Long actorId) {
        ProtectedMedia media = registryService.getForUpdate(mediaId);
        requireOwnerOrRecipient(media, actorId);

        boolean alreadyReported = securityEventService.hasEvent(mediaId, actorId, SecurityEventType.SCREENSHOT_TAKEN);
        securityEventService.append(media, actorId, SecurityEventType.SCREENSHOT_TAKEN,
                Map.of("deduped", alreadyReported));

        if (!alreadyReported) {
            systemMessagePublisher.publish(media, actorId, SecurityEventType.SCREENSHOT_TAKEN, "Screenshot taken");
        }
    }

    /**
     * Record a screenshot the device blocked. Audit only.
     */
    @Transactional
    public void reportScreenshotAttempted(Long mediaId, Long actorId) {
        ProtectedMedia media = registryService.get(mediaId);
        requireOwnerOrRecipient(media, actorId);

        securityEventService.append(media, actorId, SecurityEventType.SCREENSHOT_ATTEMPTED, null);
    }

    private void requireOwnerOrRecipient(ProtectedMedia media, Long actorId) {
        if (media.isOwnedBy(actorId)) {
            return;
        }
        if (permissionService.findOptional(media.getId(), actorId).isEmpty()) {
            log.warn("[ScreenshotPermission] User {} reported a screenshot on media {} without access",
                    actorId, media.getId());
            throw new UnauthorizedActionException("Not authorized");
        }
    }
}
