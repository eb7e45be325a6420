package io.catalogsync.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Describes a remote file that must be fetched, before download.
 */
public record FileDescriptor(
        Path targetPath,
        String locator,
        long sizeBytes,
        Instant lastModified
) {
    public FileDescriptor {
        if (targetPath == null) {
            throw new IllegalArgumentException("targetPath cannot be null");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }
}
