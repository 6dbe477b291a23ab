package com.mira.mediavault.domain.media.enums;

import lombok.Getter;

@Getter
public enum MediaReportStatus {
    PENDING("pending"),
    REVIEWED("reviewed"),
    RESOLVED("resolved");

    private final String code;

    MediaReportStatus(String code) {
        this.code = code;
    }
}
