package io.catalogsync.sink;

import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.DownloadResult;
import io.catalogsync.domain.FileDescriptor;
import io.catalogsync.domain.RemoteFileEntry;
import io.catalogsync.util.FileNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * File transfer for locators on the local file system.
 * Handles file:// URIs or plain paths.
 */
@ApplicationScoped
public class LocalFsTransfer implements FileTransfer {

    private static final Logger LOG = Logger.getLogger(LocalFsTransfer.class);

    private final int bufferSize;

    @Inject
    public LocalFsTransfer(SyncConfig config) {
        this(config.transfer().bufferSize());
    }

    public LocalFsTransfer(int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.bufferSize = bufferSize;
    }

    @Override
    public Optional<FileDescriptor> resolveLocal(RemoteFileEntry entry, Path targetFolder) throws TransferException {
        if (!FileNames.isPlainName(entry.name())) {
            throw new TransferException("Not a plain file name: " + entry.name());
        }
        // Hidden names are never counted locally
        if (FileNames.isHidden(entry.name())) {
            LOG.debugf("Skipping hidden file %s", entry.name());
            return Optional.empty();
        }
        Path target = targetFolder.resolve(entry.name());

        try {
            if (Files.isRegularFile(target)
                    && Files.size(target) == entry.sizeBytes()
                    && !isOlderThanRemote(target, entry)) {
                LOG.debugf("Up to date: %s", target);
                return Optional.empty();
            }
        } catch (IOException e) {
            throw new TransferException("Failed to read local file attributes: " + target, e);
        }

        return Optional.of(new FileDescriptor(target, entry.locator(), entry.sizeBytes(), entry.lastModified()));
    }

    @Override
    public DownloadResult download(FileDescriptor descriptor) throws TransferException {
        Path target = descriptor.targetPath();
        Path temp = target.resolveSibling("." + target.getFileName() + ".part");

        try {
            Files.createDirectories(target.getParent());

            long written;
            try (InputStream in = Files.newInputStream(extractPath(descriptor.locator()))) {
                written = writeToFile(temp, in);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            if (descriptor.lastModified() != null) {
                Files.setLastModifiedTime(target, FileTime.from(descriptor.lastModified()));
            }

            if (written != descriptor.sizeBytes()) {
                LOG.warnf("Size of %s differs from listing: expected %d, got %d bytes",
                        target, descriptor.sizeBytes(), written);
            }
            LOG.debugf("Downloaded %s -> %s (%d bytes)", descriptor.locator(), target, written);
            return DownloadResult.success(descriptor, written);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TransferException("Failed to download " + descriptor.locator() + " to " + target, e);
        }
    }

    private long writeToFile(Path target, InputStream in) throws IOException {
        try (OutputStream out = Files.newOutputStream(target,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            byte[] buffer = new byte[bufferSize];
            long totalWritten = 0;
            int bytesRead;

            while ((bytesRead = in.read(buffer)) != -1) {
                out.write(buffer, 0, bytesRead);
                totalWritten += bytesRead;
            }

            return totalWritten;
        }
    }

    private static boolean isOlderThanRemote(Path local, RemoteFileEntry entry) throws IOException {
        return entry.lastModified() != null
                && Files.getLastModifiedTime(local).toInstant().isBefore(entry.lastModified());
    }

    private static Path extractPath(String locator) {
        if (locator.startsWith("file:")) {
            return Paths.get(URI.create(locator));
        }
        return Paths.get(locator);
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf("Could not remove partial download %s: %s", temp, e.getMessage());
        }
    }
}
