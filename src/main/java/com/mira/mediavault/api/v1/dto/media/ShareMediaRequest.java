package com.mira.mediavault.api.v1.dto.media;

import com.mira.mediavault.domain.media.enums.MediaKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for sharing protected media into a conversation
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShareMediaRequest {

    @NotNull(message = "conversationId is required")
    private Long conversationId;

    /**
     * Key of the already uploaded blob
     */
    @NotBlank(message = "objectKey is required")
    private String objectKey;

    @NotNull(message = "kind is required")
    private MediaKind kind;

    @Positive(message = "timerSeconds must be positive")
    private Integer timerSeconds;

    private Boolean viewOnce;

    private Boolean watermarkEnabled;
}
