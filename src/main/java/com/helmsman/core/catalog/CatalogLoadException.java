package com.helmsman.core.catalog;

/**
 * Thrown when the pattern catalog resource is missing or malformed.
 */
public class CatalogLoadException extends RuntimeException {
    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
