package com.mira.mediavault.domain.media.enums;

/**
 * Kinds of media that can be shared under protection
 */
public enum MediaKind {
    IMAGE,
    VIDEO
}
