package io.catalogsync.sink;

import java.io.IOException;

/**
 * A single file could not be downloaded.
 */
public class TransferException extends IOException {

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
