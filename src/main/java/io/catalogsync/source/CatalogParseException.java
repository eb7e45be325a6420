package io.catalogsync.source;

/**
 * A catalog page was fetched but its content could not be understood.
 */
public class CatalogParseException extends FetchException {

    public CatalogParseException(String message) {
        super(message);
    }
}
