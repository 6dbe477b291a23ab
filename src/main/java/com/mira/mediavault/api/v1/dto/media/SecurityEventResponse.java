package com.mira.mediavault.api.v1.dto.media;

import com.mira.mediavault.domain.media.entity.SecurityEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityEventResponse {

    private Long id;
    private Long conversationId;
    private Long mediaId;
    private Long actorId;
    private String type;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;

    public static SecurityEventResponse fromEntity(SecurityEvent event) {
        return SecurityEventResponse.builder()
                .id(event.getId())
                .conversationId(event.getConversationId())
                .mediaId(event.getMediaId())
                .actorId(event.getActorId())
                .type(event.getEventType().getCode())
                .metadata(event.getMetadata())
                .createdAt(event.getCreatedAt())
                .build();
    }
}
