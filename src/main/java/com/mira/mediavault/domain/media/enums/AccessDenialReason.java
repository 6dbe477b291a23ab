package com.mira.mediavault.domain.media.enums;

import lombok.Getter;

/**
 * Expected outcomes of a refused open. These are not errors: the client renders a
 * different state for each one (expired banner, blurred placeholder, access denied).
 */
@Getter
public enum AccessDenialReason {
    DELETED("deleted"),
    NO_PERMISSION("no_permission"),
    REVOKED("revoked"),
    EXPIRED("expired"),
    VIEW_ONCE_CONSUMED("view_once_consumed");

    private final String code;

    AccessDenialReason(String code) {
        this.code = code;
    }

    /**
     * True when the media is gone for this viewer for good, as opposed to never having been shared.
     */
    public boolean isTerminal() {
        return this != NO_PERMISSION;
    }
}
