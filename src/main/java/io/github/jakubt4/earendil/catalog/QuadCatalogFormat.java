package io.github.jakubt4.earendil.catalog;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Binary layout of a quad catalog cell file. All multi-byte values are big-endian.
 *
 * <pre>
 *   [0-7]    Magic            ASCII "QUADCELL"
 *   [8]      Version          2
 *   [9-12]   Band index       int
 *   [13-16]  Cell index       int
 *   [17-20]  Pass count       int
 *   then per pass, 16 bytes:
 *            Density          float, quads per square degree
 *            Record count     int
 *            Data offset      long, absolute file position of the first record
 *   then quad records, pass by pass, in ascending density:
 *   [0-5]    Ratios           5 packed log-scale values, see {@link #packRatios}
 *   [6-9]    Largest distance float, degrees
 *   [10-13]  Midpoint RA      float, degrees
 *   [14-17]  Midpoint Dec     float, degrees
 * </pre>
 */
public final class QuadCatalogFormat {

    public static final byte[] MAGIC = "QUADCELL".getBytes(StandardCharsets.US_ASCII);
    public static final byte VERSION = 2;
    public static final String FILE_EXTENSION = ".qdb";

    public static final int HEADER_LENGTH = MAGIC.length + 1 + 3 * Integer.BYTES; // 21
    public static final int PASS_ENTRY_LENGTH = Float.BYTES + Integer.BYTES + Long.BYTES; // 16
    public static final int RATIOS_LENGTH = 6;
    public static final int RECORD_LENGTH = RATIOS_LENGTH + 3 * Float.BYTES; // 18
    public static final int MAX_PASSES = 64;

    private static final int WIDE_BITS = 10;
    private static final int NARROW_BITS = 9;
    private static final int WIDE_SCALE = (1 << WIDE_BITS) - 1;
    private static final int NARROW_SCALE = (1 << NARROW_BITS) - 1;
    /** Smallest storable non-zero ratio; smaller ones are stored as this value. */
    static final double MIN_RATIO = 0.005;
    private static final double LOG_RANGE = -Math.log(MIN_RATIO);

    private QuadCatalogFormat() {
    }

    public static long dataStart(final int passCount) {
        return HEADER_LENGTH + (long) passCount * PASS_ENTRY_LENGTH;
    }

    /**
     * Packs five ratios in {@code [0, 1]} into 48 bits. The first three get 10 bits
     * each, the last two 9 bits each.
     * <pre>
     *   bit  0..9   r0
     *   bit 10..19  r1
     *   bit 20..29  r2
     *   bit 30..38  r3
     *   bit 39..47  r4
     * </pre>
     * Codes are logarithmic over {@code [MIN_RATIO, 1]} so the rounding error is a
     * fixed fraction of the ratio (at most 0.26% with 10 bits, 0.52% with 9 bits).
     * Code 0 stands for a zero ratio.
     */
    public static void packRatios(final float[] ratios, final ByteBuffer target) {
        var packed = 0L;
        packed |= quantize(ratios[0], WIDE_SCALE);
        packed |= quantize(ratios[1], WIDE_SCALE) << 10;
        packed |= quantize(ratios[2], WIDE_SCALE) << 20;
        packed |= quantize(ratios[3], NARROW_SCALE) << 30;
        packed |= quantize(ratios[4], NARROW_SCALE) << 39;
        for (var shift = 40; shift >= 0; shift -= 8) {
            target.put((byte) (packed >>> shift));
        }
    }

    /**
     * Reverses {@link #packRatios}. Ratios stored with different widths can round past
     * each other, so the result is made non-decreasing again.
     */
    public static float[] unpackRatios(final ByteBuffer source) {
        var packed = 0L;
        for (var i = 0; i < RATIOS_LENGTH; i++) {
            packed = (packed << 8) | (source.get() & 0xFFL);
        }
        final var ratios = new float[]{
                dequantize(packed & WIDE_SCALE, WIDE_SCALE),
                dequantize((packed >>> 10) & WIDE_SCALE, WIDE_SCALE),
                dequantize((packed >>> 20) & WIDE_SCALE, WIDE_SCALE),
                dequantize((packed >>> 30) & NARROW_SCALE, NARROW_SCALE),
                dequantize((packed >>> 39) & NARROW_SCALE, NARROW_SCALE)
        };
        for (var k = 1; k < ratios.length; k++) {
            ratios[k] = Math.max(ratios[k], ratios[k - 1]);
        }
        return ratios;
    }

    private static long quantize(final float ratio, final int scale) {
        if (!(ratio > 0.0f)) {
            return 0;
        }
        final var clamped = Math.max(MIN_RATIO, Math.min(1.0, ratio));
        // code 1 is MIN_RATIO, code scale is 1
        return 1 + Math.round((scale - 1) * (1.0 + Math.log(clamped) / LOG_RANGE));
    }

    private static float dequantize(final long code, final int scale) {
        if (code == 0) {
            return 0.0f;
        }
        return (float) Math.exp(-LOG_RANGE * (scale - code) / (scale - 1));
    }
}
