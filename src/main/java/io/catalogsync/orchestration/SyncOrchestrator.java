package io.catalogsync.orchestration;

import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.CatalogIndex;
import io.catalogsync.domain.Course;
import io.catalogsync.domain.DownloadResult;
import io.catalogsync.domain.FileDescriptor;
import io.catalogsync.domain.RemoteFileEntry;
import io.catalogsync.domain.SyncReport;
import io.catalogsync.domain.SyncTask;
import io.catalogsync.sink.FileTransfer;
import io.catalogsync.sink.TransferException;
import io.catalogsync.source.CatalogBrowser;
import io.catalogsync.source.FetchException;
import io.catalogsync.tracker.CacheStore;
import io.catalogsync.tracker.LocalInventory;
import io.catalogsync.util.FileNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Synchronizes course folders with the catalog.
 * Handles the main flow: diff courses → resolve categories → download → commit cache.
 * <p>
 * A course is re-checked when the server reports more documents than the cache
 * remembers, and when the cache remembers more documents than are on disk.
 * Both checks are needed: the cache is staged before downloads finish, so only
 * the second one notices files that never arrived.
 */
@ApplicationScoped
public class SyncOrchestrator {

    private static final Logger LOG = Logger.getLogger(SyncOrchestrator.class);

    private final CatalogBrowser catalog;
    private final FileTransfer transfer;
    private final CacheStore cacheStore;
    private final LocalInventory inventory;
    private final ProgressReporter progress;
    private final int discoveryParallelism;
    private final int downloadParallelism;

    @Inject
    public SyncOrchestrator(CatalogBrowser catalog,
                            FileTransfer transfer,
                            CacheStore cacheStore,
                            LocalInventory inventory,
                            ProgressReporter progress,
                            SyncConfig config) {
        this(catalog, transfer, cacheStore, inventory, progress,
                config.discoveryParallelism(), config.downloadParallelism());
    }

    public SyncOrchestrator(CatalogBrowser catalog,
                            FileTransfer transfer,
                            CacheStore cacheStore,
                            LocalInventory inventory,
                            ProgressReporter progress,
                            int discoveryParallelism,
                            int downloadParallelism) {
        this.catalog = catalog;
        this.transfer = transfer;
        this.cacheStore = cacheStore;
        this.inventory = inventory;
        this.progress = progress;
        this.discoveryParallelism = discoveryParallelism;
        this.downloadParallelism = downloadParallelism;
    }

    /**
     * Bring the folders of the given courses under {@code baseDirectory} up to date.
     * Failures of single courses, categories or files are logged and counted
     * in the report; they never abort the run.
     */
    public SyncReport synchronize(Path baseDirectory, List<Course> courses) {
        long start = System.nanoTime();
        if (courses.isEmpty()) {
            LOG.info("No courses to synchronize");
            return SyncReport.nothingToDo(Duration.ofNanos(System.nanoTime() - start));
        }

        AtomicInteger failedCourses = new AtomicInteger();
        AtomicInteger failedCategories = new AtomicInteger();
        AtomicInteger failedDownloads = new AtomicInteger();

        progress.report(2, "Checking " + courses.size() + " course(s) for new documents...");
        List<SyncTask> tasks = new ConcurrentExecutor("discover", discoveryParallelism)
                .execute(course -> planCourse(baseDirectory, course), courses,
                        (course, error) -> failedCourses.incrementAndGet());
        LOG.debugf("Categories to resolve: %s", tasks);

        progress.report(3, "Resolving files of " + tasks.size() + " category(ies)...");
        List<FileDescriptor> files = new ConcurrentExecutor("resolve", discoveryParallelism)
                .execute(this::resolveTask, tasks,
                        (task, error) -> failedCategories.incrementAndGet());
        LOG.debugf("Files to download: %s", files);

        List<DownloadResult> results = List.of();
        if (files.isEmpty()) {
            progress.report(4, "No files to download.");
        } else {
            progress.report(4, "Downloading " + files.size() + " file(s)...");
            results = new ConcurrentExecutor("download", downloadParallelism)
                    .execute(descriptor -> List.of(transfer.download(descriptor)), files,
                            (descriptor, error) -> failedDownloads.incrementAndGet());
            progress.report(4, "All downloads finished.");
        }

        progress.report(5, "Updating cache...");
        commitCache();

        return summarize(results, Duration.ofNanos(System.nanoTime() - start),
                failedCourses.get(), failedCategories.get(), failedDownloads.get());
    }

    /**
     * Decide which categories of one course need their listing resolved.
     * Stages the course's cache when the server is ahead of it.
     */
    public List<SyncTask> planCourse(Path baseDirectory, Course course) throws IOException {
        LOG.debugf("Looking for documents of %s", course.name());
        CatalogIndex live = catalog.listCategoryIndex(course);

        // No documents, no folder
        if (live.isEmpty()) {
            LOG.infof("No documents found in %s", course.name());
            return List.of();
        }
        LOG.debugf("Counts for %s: %s", course.name(), live);

        Path folder = course.folderUnder(baseDirectory);
        Files.createDirectories(folder);

        Map<String, Integer> cached = cacheStore.load(folder, live, course.name());
        Map<String, Integer> flagged = new LinkedHashMap<>();

        Map<String, Integer> serverDiff = CountDiff.diff(live.counts(), cached);
        if (serverDiff.isEmpty()) {
            LOG.debugf("No new documents in %s since the last sync", course.name());
        } else {
            LOG.debugf("Cached: %s, on server: %s", cached, live);
            LOG.infof("Categories of %s with new documents on the server: %s", course.name(), serverDiff);
            cacheStore.stage(live, folder);
            flagged.putAll(serverDiff);
        }

        Map<String, Integer> onDisk = inventory.countFilesPerCategory(folder);
        Map<String, Integer> folderDiff = CountDiff.diff(cached, onDisk);
        if (folderDiff.isEmpty()) {
            LOG.debugf("Folder of %s matches the cached counts", course.name());
        } else {
            LOG.warnf("File count in %s does not match the last sync. Deleted files will be downloaded again.",
                    course.name());
            LOG.debugf("On disk: %s, cached: %s", onDisk, cached);
            LOG.infof("Folders of %s with fewer files than cached: %s", course.name(), folderDiff);
            folderDiff.forEach(flagged::putIfAbsent);
        }

        List<SyncTask> tasks = new ArrayList<>(flagged.size());
        for (String category : flagged.keySet()) {
            if (!FileNames.isPlainName(category)) {
                LOG.warnf("Category name %s of %s is not a plain folder name, skipping", category, course.name());
                continue;
            }
            Optional<String> categoryId = live.categoryId(category);
            if (categoryId.isEmpty()) {
                LOG.warnf("Category %s of %s is no longer in the catalog, skipping", category, course.name());
                continue;
            }
            tasks.add(new SyncTask(category, categoryId.get(), course, folder));
        }

        LOG.debugf("Categories of %s to resolve: %s", course.name(), tasks);
        return tasks;
    }

    /**
     * List one flagged category and keep the files whose local copy is missing or stale.
     */
    public List<FileDescriptor> resolveTask(SyncTask task) throws FetchException {
        LOG.debugf("Looking for %s", task);
        List<RemoteFileEntry> entries = catalog.listCategoryFiles(task.course(), task.categoryId());
        Path folder = task.categoryFolder();

        List<FileDescriptor> files = new ArrayList<>();
        for (RemoteFileEntry entry : entries) {
            try {
                transfer.resolveLocal(entry, folder).ifPresent(files::add);
            } catch (TransferException e) {
                LOG.warnf("Skipping %s in %s: %s", entry.name(), task, e.getMessage());
            }
        }

        LOG.debugf("%s: %d of %d file(s) to download", task, files.size(), entries.size());
        return files;
    }

    private void commitCache() {
        try {
            cacheStore.commit();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to commit the cache, affected courses are checked again next run");
        }
    }

    private SyncReport summarize(List<DownloadResult> results, Duration elapsed,
                                 int failedCourses, int failedCategories, int failedDownloads) {
        long bytes = 0;
        TreeSet<Path> folders = new TreeSet<>();

        for (DownloadResult result : results) {
            bytes += result.bytesTransferred();
            folders.add(result.descriptor().targetPath().getParent());
        }

        LOG.infof("Sync complete: %d file(s), %d byte(s) in %d ms, %d failed item(s)",
                results.size(), bytes, elapsed.toMillis(), failedCourses + failedCategories + failedDownloads);
        return new SyncReport(results.size(), bytes, elapsed, new ArrayList<>(folders),
                failedCourses, failedCategories, failedDownloads);
    }
}
