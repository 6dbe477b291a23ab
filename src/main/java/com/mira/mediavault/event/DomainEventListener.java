package com.mira.mediavault.event;

import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.integration.storage.MediaStorageService;
import com.mira.mediavault.websocket.WebSocketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.LocalDateTime;

/**
 * Domain Event Listener
 * Runs the side effects of protected media state changes once the change has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainEventListener {

    private final WebSocketService webSocketService;
    private final MediaStorageService storageService;

    /**
     * Forward a chat-timeline system message to the conversation channel.
     * Delivery is best effort; the audit trail is the record of truth.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Async
    public void handleSystemMessage(MediaSystemMessageEvent event) {
        log.debug("Handling MediaSystemMessageEvent {} for media {}", event.subtype(), event.mediaId());

        try {
            webSocketService.sendSystemMessage(event);
        } catch (Exception e) {
            log.warn("System message broadcast failed for media {}: {}", event.mediaId(), e.getMessage());
        }
    }

    /**
     * Physically remove the blob of a burned media item.
     * A failed delete never undoes the logical expiry.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleMediaBurned(MediaBurnedEvent event) {
        log.debug("Handling MediaBurnedEvent for media {}", event.mediaId());

        try {
            storageService.delete(event.objectKey());
        } catch (RuntimeException e) {
            log.error("Failed to delete blob {} of burned media {}", event.objectKey(), event.mediaId(), e);
        }
    }

    public record MediaSystemMessageEvent(Long conversationId, Long mediaId, Long actorId,
                                          SecurityEventType subtype, String content,
                                          LocalDateTime occurredAt) {}

    public record MediaBurnedEvent(Long mediaId, String objectKey) {}
}
