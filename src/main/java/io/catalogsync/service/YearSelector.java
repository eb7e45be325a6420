package io.catalogsync.service;

import io.catalogsync.orchestration.SyncException;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses which academic year to synchronize.
 */
public final class YearSelector {

    private YearSelector() {
        // Utility class
    }

    /**
     * @param years          label to year key, as listed by the catalog
     * @param requestedLabel a label or year key asked for explicitly
     * @param autoSelect     pick the newest year when several are available
     * @return the year key to synchronize
     */
    public static String select(Map<String, String> years, Optional<String> requestedLabel, boolean autoSelect) {
        if (years.isEmpty()) {
            throw new SyncException("No academic years found for this user");
        }

        if (requestedLabel.isPresent()) {
            String requested = requestedLabel.get();
            if (years.containsKey(requested)) {
                return years.get(requested);
            }
            if (years.containsValue(requested)) {
                return requested;
            }
            throw new SyncException("Unknown academic year '" + requested + "', available: " + years.keySet());
        }

        if (years.size() == 1) {
            return years.values().iterator().next();
        }
        if (autoSelect) {
            return Collections.max(years.values());
        }
        throw new SyncException("Several academic years available, choose one with --year: " + years.keySet());
    }
}
