package io.github.jakubt4.earendil.sky;

/**
 * A declination strip of the sky grid. All cells in a band share the same RA width.
 *
 * @param index       0 for the northernmost band
 * @param decBottom   lower (exclusive) declination limit
 * @param decTop      upper (inclusive) declination limit
 * @param cellRaWidth RA width of every cell in the band, divides 360 evenly
 */
public record Band(int index, double decBottom, double decTop, double cellRaWidth) {

    public int cellCount() {
        return (int) Math.round(360.0 / cellRaWidth);
    }

    public boolean containsDec(final double dec) {
        return (dec > decBottom && dec <= decTop) || (dec == -90.0 && decBottom == -90.0);
    }
}
