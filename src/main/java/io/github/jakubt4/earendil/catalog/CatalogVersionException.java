package io.github.jakubt4.earendil.catalog;

/**
 * The file does not start with the quad catalog magic, or declares a format
 * version this reader does not understand.
 */
public class CatalogVersionException extends CatalogException {

    private final int foundVersion;

    public CatalogVersionException(final String message, final int foundVersion) {
        super(message);
        this.foundVersion = foundVersion;
    }

    /** The version byte read from the file, or -1 if the magic itself did not match. */
    public int foundVersion() {
        return foundVersion;
    }
}
