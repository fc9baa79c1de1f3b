package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.sky.EquatorialCoords;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw catalog star as stored in the per-cell star files produced by extraction.
 *
 * <pre>
 *   [0-7]   RA         IEEE 754 double, degrees, big-endian
 *   [8-15]  Dec        IEEE 754 double, degrees, big-endian
 *   [16-19] Magnitude  IEEE 754 float, big-endian
 * </pre>
 */
public record StarRecord(double ra, double dec, float magnitude) {

    public static final int BYTES = 2 * Double.BYTES + Float.BYTES;
    public static final String FILE_EXTENSION = ".stars";

    public EquatorialCoords coords() {
        return new EquatorialCoords(ra, dec);
    }

    public void writeTo(final ByteBuffer buffer) {
        buffer.putDouble(ra);
        buffer.putDouble(dec);
        buffer.putFloat(magnitude);
    }

    public static StarRecord readFrom(final ByteBuffer buffer) {
        return new StarRecord(buffer.getDouble(), buffer.getDouble(), buffer.getFloat());
    }

    /**
     * Reads a whole star file. A trailing partial record is reported as a format error.
     */
    public static List<StarRecord> readAll(final Path file) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read star file " + file, e);
        }
        if (bytes.length % BYTES != 0) {
            throw new CatalogFormatException("Star file " + file + " is not a whole number of "
                    + BYTES + "-byte records (" + bytes.length + " bytes)");
        }
        final var buffer = ByteBuffer.wrap(bytes);
        final var stars = new ArrayList<StarRecord>(bytes.length / BYTES);
        while (buffer.hasRemaining()) {
            stars.add(readFrom(buffer));
        }
        return stars;
    }
}
