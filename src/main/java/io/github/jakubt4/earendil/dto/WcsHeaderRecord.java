package io.github.jakubt4.earendil.dto;

/**
 * One keyword of the WCS header block handed to the FITS writing layer.
 */
public record WcsHeaderRecord(String keyword, HeaderValue value, String comment) {

    public static WcsHeaderRecord of(final String keyword, final double value, final String comment) {
        return new WcsHeaderRecord(keyword, HeaderValue.ofFloat(value), comment);
    }

    public static WcsHeaderRecord of(final String keyword, final long value, final String comment) {
        return new WcsHeaderRecord(keyword, HeaderValue.ofInteger(value), comment);
    }

    public static WcsHeaderRecord of(final String keyword, final String value, final String comment) {
        return new WcsHeaderRecord(keyword, HeaderValue.ofString(value), comment);
    }

    public static WcsHeaderRecord comment(final String text) {
        return new WcsHeaderRecord("COMMENT", HeaderValue.absent(), text);
    }
}
