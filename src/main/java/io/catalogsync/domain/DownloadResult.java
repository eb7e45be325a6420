package io.catalogsync.domain;

/**
 * A completed file download. Failed downloads surface as
 * {@link io.catalogsync.sink.TransferException} instead.
 */
public record DownloadResult(
        FileDescriptor descriptor,
        long bytesTransferred
) {
    public DownloadResult {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (bytesTransferred < 0) {
            throw new IllegalArgumentException("bytesTransferred cannot be negative");
        }
    }

    public static DownloadResult success(FileDescriptor descriptor, long bytes) {
        return new DownloadResult(descriptor, bytes);
    }
}
