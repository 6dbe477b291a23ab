package com.mira.mediavault.api.v1.dto.media;

import com.mira.mediavault.domain.media.enums.ScreenshotMode;
import jakarta.validation.constraints.NotNull;

public record ScreenshotPermissionRequest(@NotNull(message = "mode is required") ScreenshotMode mode) {}
