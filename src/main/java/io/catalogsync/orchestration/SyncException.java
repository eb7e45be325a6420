package io.catalogsync.orchestration;

/**
 * A run-level failure that stops the whole synchronization.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
