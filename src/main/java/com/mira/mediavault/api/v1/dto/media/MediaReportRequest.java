package com.mira.mediavault.api.v1.dto.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param reason         report reason code, e.g. screenshot_abuse
 * @param reportedUserId optional, the media owner when absent
 */
public record MediaReportRequest(
        @NotBlank(message = "reason is required") String reason,
        Long reportedUserId,
        @Size(max = 1000, message = "description must be at most 1000 characters") String description
) {}
