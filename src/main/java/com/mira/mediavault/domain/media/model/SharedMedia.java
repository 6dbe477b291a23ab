package com.mira.mediavault.domain.media.model;

import java.util.Map;

/**
 * Result of sharing: the new media id and the permission id created for each recipient.
 */
public record SharedMedia(Long mediaId, Map<Long, Long> permissionIdsByRecipient) {}
