package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.api.v1.dto.media.ShareMediaRequest;
import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.model.SharedMedia;
import com.mira.mediavault.exception.BusinessException;
import com.mira.mediavault.exception.UnauthorizedActionException;
import com.mira.mediavault.integration.conversation.ConversationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shares a media item into a conversation: registers it and creates one permission row per
 * other participant, all in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaSharingService {

    private final MediaRegistryService registryService;
    private final MediaPermissionService permissionService;
    private final SecurityEventService securityEventService;
    private final ConversationDirectory conversationDirectory;

    @Transactional
    public SharedMedia share(Long ownerId, ShareMediaRequest request) {
        Set<Long> participants = conversationDirectory.findParticipants(request.getConversationId());
        if (!participants.contains(ownerId)) {
            log.warn("[MediaSharing] User {} is not a participant of conversation {}",
                    ownerId, request.getConversationId());
            throw new UnauthorizedActionException("Not a participant of this conversation");
        }
        if (participants.size() < 2) {
            throw new BusinessException("Conversation has no recipients");
        }

        ProtectedMedia media = registryService.createMedia(ownerId, request.getConversationId(),
                request.getObjectKey(), request.getKind(), request.getTimerSeconds(),
                request.getViewOnce(), request.getWatermarkEnabled());

        Map<Long, Long> permissionIds = new LinkedHashMap<>();
        for (Long participantId : participants) {
            if (participantId.equals(ownerId)) {
                continue;
            }
            MediaPermission permission = permissionService.createPermission(media, ownerId, participantId);
            permissionIds.put(participantId, permission.getId());
        }

        securityEventService.append(media, ownerId, SecurityEventType.MEDIA_SHARED,
                Map.of("recipientCount", permissionIds.size()));

        log.info("[MediaSharing] Media {} shared in conversation {} with {} recipients",
                media.getId(), request.getConversationId(), permissionIds.size());
        return new SharedMedia(media.getId(), permissionIds);
    }
}
