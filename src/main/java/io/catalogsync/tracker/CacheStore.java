package io.catalogsync.tracker;

import io.catalogsync.domain.CatalogIndex;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Per-course record of category counts as of the last successful sync.
 * Records are keyed by the course's local folder, so courses never contend.
 */
public interface CacheStore {

    /**
     * Read the committed record of a course. A missing or unreadable record
     * loads as an empty mapping, which makes every live category new.
     */
    Map<String, Integer> load(Path coursePath, CatalogIndex liveIndex, String courseName);

    /**
     * Record the observed live counts as the course's new record. The write
     * is optimistic: it happens before the implied downloads have finished.
     */
    void stage(CatalogIndex liveIndex, Path coursePath) throws IOException;

    /**
     * Make every staged record of the run durable.
     */
    void commit() throws IOException;
}
