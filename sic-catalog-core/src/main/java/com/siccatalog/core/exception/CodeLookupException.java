package com.siccatalog.core.exception;

/**
 * Thrown when a code key cannot be resolved to a node.
 *
 * <p>During construction this means a derived key (a parent code, an activity code, a
 * metadata code) is missing from the source hierarchy. At query time it is raised by
 * {@code Hierarchy#get(String)} for unknown keys.
 */
public class CodeLookupException extends CatalogException {

    private final String key;

    public CodeLookupException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * Returns the key that could not be resolved.
     *
     * @return missing key
     */
    public String getKey() {
        return key;
    }
}
