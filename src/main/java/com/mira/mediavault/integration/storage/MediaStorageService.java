package com.mira.mediavault.integration.storage;

import java.time.Duration;

/**
 * Opaque blob store holding protected media bytes, keyed by object key.
 */
public interface MediaStorageService {

    /**
     * Issue a short-lived locator (signed URL) for an object
     * @param objectKey storage key of the media
     * @param ttl how long the locator stays valid
     * @return the locator handed to the viewer
     */
    String createLocator(String objectKey, Duration ttl);

    /**
     * Delete an object. Physical deletion may be eventual.
     * @param objectKey storage key of the media
     * @throws MediaStorageException if the store rejects the delete
     */
    void delete(String objectKey);
}
