package io.github.jakubt4.earendil.catalog;

/**
 * Base type for failures reading or writing quad catalog files.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(final String message) {
        super(message);
    }

    public CatalogException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
