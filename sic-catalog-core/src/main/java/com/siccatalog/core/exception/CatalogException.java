package com.siccatalog.core.exception;

/**
 * Base class for failures raised while building or querying a classification catalog.
 *
 * <p>All subclasses are unrecoverable at the point they are raised: hierarchy construction
 * aborts and no catalog is published.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
