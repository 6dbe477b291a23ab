package com.mira.mediavault.domain.media.enums;

import lombok.Getter;

/**
 * Event types recorded in the protected media audit trail
 */
@Getter
public enum SecurityEventType {
    MEDIA_SHARED("media_shared"),
    MEDIA_OPENED("media_opened"),
    MEDIA_EXPIRED("media_expired"),
    PERMISSION_GRANTED("permission_granted"),
    PERMISSION_REVOKED("permission_revoked"),
    ACCESS_REVOKED("access_revoked"),
    ACCESS_REQUESTED("access_requested"),
    SCREENSHOT_TAKEN("screenshot_taken"),
    SCREENSHOT_ATTEMPTED("screenshot_attempted");

    private final String code;

    SecurityEventType(String code) {
        this.code = code;
    }

    public static SecurityEventType fromCode(String code) {
        for (SecurityEventType type : SecurityEventType.values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown SecurityEventType code: " + code);
    }
}
