package com.mira.mediavault.domain.media.model;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * What a viewer receives on a successful open.
 *
 * @param locator         short-lived URL to the media bytes
 * @param allowScreenshot whether the client may leave screenshots enabled
 * @param shouldBlur      whether the client blurs the media when backgrounded
 * @param watermarkText   viewer-identifying overlay, null when watermarking is off
 * @param expiresAt       end of the viewer's access window, null when unbounded
 */
@Builder
public record MediaViewGrant(
        Long mediaId,
        String locator,
        boolean allowScreenshot,
        boolean shouldBlur,
        String watermarkText,
        LocalDateTime expiresAt,
        boolean viewOnce,
        Integer timerSeconds,
        boolean owner,
        int viewCount
) {}
