package io.catalogsync.tracker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.CatalogIndex;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache store keeping one JSON record per course folder.
 * <p>
 * {@link #stage} writes {@code <name>.staged} next to the committed record;
 * {@link #commit} moves every staged record over its committed one. A run
 * that dies before commit leaves the previous committed records untouched.
 */
@ApplicationScoped
public class FileCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(FileCacheStore.class);
    private static final TypeReference<LinkedHashMap<String, Integer>> RECORD_TYPE = new TypeReference<>() {
    };

    private final String cacheFileName;
    private final ObjectMapper mapper;
    private final Set<Path> stagedCourses = ConcurrentHashMap.newKeySet();

    @Inject
    public FileCacheStore(SyncConfig config, ObjectMapper mapper) {
        this(config.cacheFileName(), mapper);
    }

    public FileCacheStore(String cacheFileName, ObjectMapper mapper) {
        if (cacheFileName == null || cacheFileName.isBlank()) {
            throw new IllegalArgumentException("cacheFileName cannot be blank");
        }
        this.cacheFileName = cacheFileName;
        this.mapper = mapper;
    }

    @Override
    public Map<String, Integer> load(Path coursePath, CatalogIndex liveIndex, String courseName) {
        Path record = recordPath(coursePath);
        if (!Files.exists(record)) {
            LOG.debugf("No cache for %s, every category counts as new", courseName);
            return new LinkedHashMap<>();
        }

        try {
            LinkedHashMap<String, Integer> counts = mapper.readValue(record.toFile(), RECORD_TYPE);
            if (counts == null) {
                return new LinkedHashMap<>();
            }
            counts.values().removeIf(count -> count == null || count < 0);
            LOG.debugf("Cache for %s: %s (live: %s)", courseName, counts, liveIndex);
            return counts;
        } catch (IOException e) {
            LOG.warnf("Unreadable cache for %s at %s, starting from an empty cache: %s",
                    courseName, record, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    @Override
    public void stage(CatalogIndex liveIndex, Path coursePath) throws IOException {
        Path staged = stagedPath(coursePath);
        Files.createDirectories(coursePath);

        // Temp file then atomic rename
        Path temp = staged.resolveSibling(staged.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), liveIndex.counts());
            Files.move(temp, staged, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        stagedCourses.add(coursePath);
        LOG.debugf("Staged cache %s: %s", staged, liveIndex);
    }

    @Override
    public void commit() throws IOException {
        List<IOException> failures = new ArrayList<>();

        for (Path coursePath : List.copyOf(stagedCourses)) {
            try {
                Files.move(stagedPath(coursePath), recordPath(coursePath),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                stagedCourses.remove(coursePath);
            } catch (NoSuchFileException e) {
                LOG.warnf("Staged cache vanished before commit: %s", e.getFile());
                stagedCourses.remove(coursePath);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to commit cache for %s", coursePath);
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            IOException failure = new IOException(failures.size() + " cache record(s) could not be committed");
            failures.forEach(failure::addSuppressed);
            throw failure;
        }
    }

    public Path recordPath(Path coursePath) {
        return coursePath.resolve(cacheFileName);
    }

    Path stagedPath(Path coursePath) {
        return coursePath.resolve(cacheFileName + ".staged");
    }
}
