package io.catalogsync.orchestration;

/**
 * Receives human-facing progress of a run. Purely observational.
 */
public interface ProgressReporter {
    void report(int stage, String message);
}
