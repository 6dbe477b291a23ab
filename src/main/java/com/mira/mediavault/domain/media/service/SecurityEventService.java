package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.entity.SecurityEvent;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.repository.ProtectedMediaRepository;
import com.mira.mediavault.domain.media.repository.SecurityEventRepository;
import com.mira.mediavault.exception.ResourceNotFoundException;
import com.mira.mediavault.exception.UnauthorizedActionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only security audit log for protected media.
 * Writes join the caller's transaction so an event is committed together with the change it records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityEventService {

    private final SecurityEventRepository eventRepository;
    private final ProtectedMediaRepository mediaRepository;
    private final Clock clock;

    @Transactional
    public SecurityEvent append(Long conversationId, Long mediaId, Long actorId,
                                SecurityEventType type, Map<String, Object> metadata) {
        SecurityEvent event = SecurityEvent.builder()
                .conversationId(conversationId)
                .mediaId(mediaId)
                .actorId(actorId)
                .eventType(type)
                .metadata(metadata != null && !metadata.isEmpty() ? new LinkedHashMap<>(metadata) : null)
                .createdAt(LocalDateTime.now(clock))
                .build();

        SecurityEvent saved = eventRepository.save(event);
        log.info("[SecurityEvent] {} media={} actor={}", type.getCode(), mediaId, actorId);
        return saved;
    }

    @Transactional
    public SecurityEvent append(ProtectedMedia media, Long actorId, SecurityEventType type,
                                Map<String, Object> metadata) {
        return append(media.getConversationId(), media.getId(), actorId, type, metadata);
    }

    /**
     * Full event list for a media item. Only the owner has forensic visibility.
     *
     * @param type optional filter, null for all events
     */
    @Transactional(readOnly = true)
    public List<SecurityEvent> listForMedia(Long mediaId, Long requesterId, SecurityEventType type) {
        requireOwner(mediaId, requesterId);

        if (type != null) {
            return eventRepository.findByMediaIdAndEventTypeOrderByCreatedAtAscIdAsc(mediaId, type);
        }
        return eventRepository.findByMediaIdOrderByCreatedAtAscIdAsc(mediaId);
    }

    /**
     * Per-type event counts for the owner's audit summary. Every type is present, zero when absent.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> countByType(Long mediaId, Long requesterId) {
        requireOwner(mediaId, requesterId);

        Map<String, Long> stats = new LinkedHashMap<>();
        for (SecurityEventType type : SecurityEventType.values()) {
            stats.put(type.getCode(), 0L);
        }
        for (Object[] row : eventRepository.countByEventTypeForMedia(mediaId)) {
            SecurityEventType type = (SecurityEventType) row[0];
            stats.put(type.getCode(), ((Number) row[1]).longValue());
        }
        return stats;
    }

    public boolean hasEvent(Long mediaId, Long actorId, SecurityEventType type) {
        return eventRepository.existsByMediaIdAndActorIdAndEventType(mediaId, actorId, type);
    }

    public boolean hasEvent(Long mediaId, SecurityEventType type) {
        return eventRepository.existsByMediaIdAndEventType(mediaId, type);
    }

    private void requireOwner(Long mediaId, Long requesterId) {
        ProtectedMedia media = mediaRepository.findById(mediaId)
                .orElseThrow(() -> new ResourceNotFoundException("ProtectedMedia", mediaId));

        if (!media.isOwnedBy(requesterId)) {
            log.warn("[SecurityEvent] User {} denied audit access to media {}", requesterId, mediaId);
            throw new UnauthorizedActionException("Only the media owner can view security events");
        }
    }
}
