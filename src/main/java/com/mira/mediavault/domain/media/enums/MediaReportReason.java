package com.mira.mediavault.domain.media.enums;

import lombok.Getter;

/**
 * Why a participant reported a media item
 */
@Getter
public enum MediaReportReason {
    INAPPROPRIATE_CONTENT("inappropriate_content"),
    NON_CONSENSUAL("non_consensual"),
    SCREENSHOT_ABUSE("screenshot_abuse"),
    HARASSMENT("harassment"),
    OTHER("other");

    private final String code;

    MediaReportReason(String code) {
        this.code = code;
    }

    public static MediaReportReason fromCode(String code) {
        for (MediaReportReason reason : MediaReportReason.values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown MediaReportReason code: " + code);
    }
}
