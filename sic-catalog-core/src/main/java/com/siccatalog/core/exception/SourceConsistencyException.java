package com.siccatalog.core.exception;

/**
 * Thrown when two sources disagree about the shape of the classification, for example
 * a metadata source whose entry count differs from the number of structural rows.
 */
public class SourceConsistencyException extends CatalogException {

    public SourceConsistencyException(String message) {
        super(message);
    }
}
