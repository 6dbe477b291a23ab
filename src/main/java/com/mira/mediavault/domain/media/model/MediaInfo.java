package com.mira.mediavault.domain.media.model;

import com.mira.mediavault.domain.media.enums.MediaKind;
import lombok.Builder;

/**
 * Read-only status of a protected media item as seen by one user, used to render the chat bubble.
 */
@Builder
public record MediaInfo(
        Long mediaId,
        MediaKind kind,
        Integer timerSeconds,
        boolean viewOnce,
        boolean watermarkEnabled,
        boolean canScreenshot,
        boolean expired,
        boolean owner
) {}
