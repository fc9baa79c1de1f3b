package io.github.jakubt4.earendil.catalog;

/**
 * The file is truncated or its header is internally inconsistent.
 */
public class CatalogFormatException extends CatalogException {

    public CatalogFormatException(final String message) {
        super(message);
    }

    public CatalogFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
