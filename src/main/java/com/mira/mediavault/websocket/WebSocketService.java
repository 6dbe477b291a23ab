package com.mira.mediavault.websocket;

import com.mira.mediavault.event.DomainEventListener.MediaSystemMessageEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * WebSocket Service
 * Pushes protected media system messages to conversation channels via STOMP
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebSocketService {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Send a system message to everyone subscribed to the conversation
     */
    public void sendSystemMessage(MediaSystemMessageEvent event) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "system");
        payload.put("system_subtype", event.subtype().getCode());
        payload.put("conversation_id", event.conversationId());
        payload.put("media_id", event.mediaId());
        payload.put("sender_id", event.actorId());
        payload.put("content", event.content());
        payload.put("created_at", event.occurredAt().toString());

        String destination = "/topic/conversation." + event.conversationId();
        messagingTemplate.convertAndSend(destination, payload);

        log.debug("Sent {} system message to conversation channel {}",
                event.subtype().getCode(), event.conversationId());
    }
}
