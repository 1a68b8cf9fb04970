package com.siccatalog.core.exception;

/**
 * Thrown when a classification code is malformed, or when a code does not agree
 * with the level or section it was supplied with.
 */
public class CodeFormatException extends CatalogException {

    public CodeFormatException(String message) {
        super(message);
    }
}
