package io.catalogsync.tracker;

import io.catalogsync.domain.CatalogIndex;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory cache store.
 * Not persistent - state is lost on restart.
 */
public class InMemoryCacheStore implements CacheStore {

    private final Map<Path, Map<String, Integer>> committed = new ConcurrentHashMap<>();
    private final Map<Path, Map<String, Integer>> staged = new ConcurrentHashMap<>();

    @Override
    public Map<String, Integer> load(Path coursePath, CatalogIndex liveIndex, String courseName) {
        Map<String, Integer> record = committed.get(coursePath);
        return record != null ? new LinkedHashMap<>(record) : new LinkedHashMap<>();
    }

    @Override
    public void stage(CatalogIndex liveIndex, Path coursePath) {
        staged.put(coursePath, Map.copyOf(liveIndex.counts()));
    }

    @Override
    public void commit() {
        committed.putAll(staged);
        staged.clear();
    }

    /**
     * Seed a committed record, as left behind by an earlier run.
     */
    public void put(Path coursePath, Map<String, Integer> counts) {
        committed.put(coursePath, Map.copyOf(counts));
    }

    public Optional<Map<String, Integer>> committed(Path coursePath) {
        return Optional.ofNullable(committed.get(coursePath));
    }

    public boolean hasStaged(Path coursePath) {
        return staged.containsKey(coursePath);
    }
}
