package io.catalogsync.source;

import java.io.IOException;

/**
 * A catalog page could not be fetched. Scoped to one course or category.
 */
public class FetchException extends IOException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
