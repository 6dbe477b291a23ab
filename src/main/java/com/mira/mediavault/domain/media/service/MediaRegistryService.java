package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.MediaKind;
import com.mira.mediavault.domain.media.repository.ProtectedMediaRepository;
import com.mira.mediavault.event.DomainEventListener.MediaBurnedEvent;
import com.mira.mediavault.exception.BusinessException;
import com.mira.mediavault.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Media Registry
 * Owns the canonical protected media records and their soft deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaRegistryService {

    private final ProtectedMediaRepository mediaRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Register a media item. Permission fan-out is the caller's job, in the same transaction.
     *
     * @param timerSeconds     optional access window per recipient, started on first open
     * @param viewOnce         defaults to false
     * @param watermarkEnabled defaults to true
     */
    @Transactional
    public ProtectedMedia createMedia(Long ownerId, Long conversationId, String objectKey, MediaKind kind,
                                      Integer timerSeconds, Boolean viewOnce, Boolean watermarkEnabled) {
        if (timerSeconds != null && timerSeconds <= 0) {
            throw new BusinessException("timerSeconds must be positive");
        }
        if (objectKey == null || objectKey.isBlank()) {
            throw new BusinessException("objectKey is required");
        }
        if (kind == null) {
            throw new BusinessException("kind is required");
        }

        ProtectedMedia media = ProtectedMedia.builder()
                .ownerId(ownerId)
                .conversationId(conversationId)
                .objectKey(objectKey)
                .kind(kind)
                .timerSeconds(timerSeconds)
                .viewOnce(Boolean.TRUE.equals(viewOnce))
                .watermarkEnabled(watermarkEnabled == null || watermarkEnabled)
                .createdAt(LocalDateTime.now(clock))
                .build();

        ProtectedMedia saved = mediaRepository.save(media);
        log.info("[MediaRegistry] Created media {} owner={} conversation={} kind={} timer={} viewOnce={}",
                saved.getId(), ownerId, conversationId, kind, timerSeconds, saved.isViewOnce());
        return saved;
    }

    @Transactional(readOnly = true)
    public ProtectedMedia get(Long mediaId) {
        return mediaRepository.findById(mediaId)
                .orElseThrow(() -> new ResourceNotFoundException("ProtectedMedia", mediaId));
    }

    /**
     * Load with a row lock held until the surrounding transaction ends.
     */
    @Transactional
    public ProtectedMedia getForUpdate(Long mediaId) {
        return mediaRepository.findByIdForUpdate(mediaId)
                .orElseThrow(() -> new ResourceNotFoundException("ProtectedMedia", mediaId));
    }

    /**
     * Burn a media item: clear its object key, stamp deletedAt, and request blob deletion
     * after commit. Deleting an already deleted item is a no-op.
     */
    @Transactional
    public void softDelete(Long mediaId) {
        softDelete(getForUpdate(mediaId));
    }

    @Transactional
    public void softDelete(ProtectedMedia media) {
        String objectKey = media.markDeleted(LocalDateTime.now(clock));
        if (objectKey == null) {
            log.debug("[MediaRegistry] Media {} already deleted", media.getId());
            return;
        }

        mediaRepository.save(media);
        eventPublisher.publishEvent(new MediaBurnedEvent(media.getId(), objectKey));
        log.info("[MediaRegistry] Media {} soft-deleted, blob {} scheduled for removal", media.getId(), objectKey);
    }

    /**
     * Live ephemeral media that nobody can open anymore, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ProtectedMedia> findSpentEphemeralMedia(int limit) {
        return mediaRepository.findSpentEphemeralMedia(LocalDateTime.now(clock), PageRequest.of(0, limit));
    }
}
