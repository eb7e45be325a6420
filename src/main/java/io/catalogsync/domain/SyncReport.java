package io.catalogsync.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Summary of a synchronization run.
 */
public record SyncReport(
        int filesTransferred,
        long bytesTransferred,
        Duration elapsed,
        List<Path> foldersTouched,
        int failedCourses,
        int failedCategories,
        int failedDownloads
) {
    public SyncReport {
        foldersTouched = foldersTouched != null ? List.copyOf(foldersTouched) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public static SyncReport nothingToDo(Duration elapsed) {
        return new SyncReport(0, 0, elapsed, List.of(), 0, 0, 0);
    }

    public int failedItems() {
        return failedCourses + failedCategories + failedDownloads;
    }
}
