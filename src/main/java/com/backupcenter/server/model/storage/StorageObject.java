package com.backupcenter.server.model.storage;

import java.time.Instant;

/**
 * One artifact returned by a recursive listing.
 *
 * @param path         path relative to the backend root, always with forward slashes
 * @param lastModified modification time reported by the backend, null when unknown
 * @param sizeBytes    size of the object
 */
public record StorageObject(String path, Instant lastModified, long sizeBytes) {
}
