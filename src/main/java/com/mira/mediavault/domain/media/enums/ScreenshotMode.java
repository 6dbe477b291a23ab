package com.mira.mediavault.domain.media.enums;

/**
 * Screenshot permission modes the media owner can set per recipient.
 * ON_FOR_10_MIN grants screenshots until a deadline computed at grant time.
 */
public enum ScreenshotMode {
    OFF,
    ON,
    ON_FOR_10_MIN;

    public boolean allowsScreenshots() {
        return this != OFF;
    }

    public boolean isTimeBoxed() {
        return this == ON_FOR_10_MIN;
    }
}
