package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.event.DomainEventListener.MediaSystemMessageEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Raises the chat-timeline system message that accompanies a protected media action.
 * Delivery happens after commit, so rolled back actions never announce themselves.
 */
@Component
@RequiredArgsConstructor
public class MediaSystemMessagePublisher {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void publish(ProtectedMedia media, Long actorId, SecurityEventType subtype, String content) {
        eventPublisher.publishEvent(new MediaSystemMessageEvent(
                media.getConversationId(), media.getId(), actorId, subtype, content, LocalDateTime.now(clock)));
    }
}
