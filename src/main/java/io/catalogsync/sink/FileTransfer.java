package io.catalogsync.sink;

import io.catalogsync.domain.DownloadResult;
import io.catalogsync.domain.FileDescriptor;
import io.catalogsync.domain.RemoteFileEntry;

import java.nio.file.Path;
import java.util.Optional;

public interface FileTransfer {

    /**
     * Decide whether a remote entry must be fetched into the given folder.
     * Returns empty when the local copy is already current.
     */
    Optional<FileDescriptor> resolveLocal(RemoteFileEntry entry, Path targetFolder) throws TransferException;

    DownloadResult download(FileDescriptor descriptor) throws TransferException;
}
