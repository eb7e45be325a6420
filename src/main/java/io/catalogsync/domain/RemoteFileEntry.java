package io.catalogsync.domain;

import java.time.Instant;

/**
 * One row of a category's file listing on the server.
 */
public record RemoteFileEntry(
        String name,
        String locator,
        long sizeBytes,
        Instant lastModified
) {
    public RemoteFileEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }
}
