package com.mira.mediavault.api.v1.dto.media;

import jakarta.validation.constraints.NotNull;

/**
 * Report from the device screenshot hook. taken=false means the device blocked the attempt.
 */
public record ScreenshotReportRequest(@NotNull(message = "taken is required") Boolean taken) {}
