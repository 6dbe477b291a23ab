package com.mira.mediavault.domain.media.model;

import com.mira.mediavault.domain.media.enums.AccessDenialReason;

/**
 * Outcome of an open: exactly one of grant or denial is set.
 */
public record MediaOpenResult(MediaViewGrant grant, AccessDenialReason denial) {

    public static MediaOpenResult granted(MediaViewGrant grant) {
        return new MediaOpenResult(grant, null);
    }

    public static MediaOpenResult denied(AccessDenialReason reason) {
        return new MediaOpenResult(null, reason);
    }

    public boolean isGranted() {
        return grant != null;
    }
}
