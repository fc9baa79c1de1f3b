package io.github.jakubt4.earendil.sky;

import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One unit of the sky grid.
 *
 * @param cellId    stable identifier, {@code bNNcMM}
 * @param bandIndex owning band
 * @param cellIndex position within the band, counted from RA 0 eastward
 * @param bounds    the rectangle the cell covers
 */
public record Cell(String cellId, int bandIndex, int cellIndex, RaDecBounds bounds) {

    private static final double SQ_DEG_PER_STERADIAN = FastMath.toDegrees(1.0) * FastMath.toDegrees(1.0);

    public static String formatId(final int bandIndex, final int cellIndex) {
        return String.format(Locale.ROOT, "b%02dc%02d", bandIndex, cellIndex);
    }

    public EquatorialCoords center() {
        return bounds.center();
    }

    /** Angular width measured along the cell's central parallel. */
    public double widthDeg() {
        final var dec = center().dec();
        final var left = new EquatorialCoords(bounds.raLeft(), dec);
        final var right = EquatorialCoords.normalized(bounds.raLeft() + bounds.raWidth(), dec);
        return left.angularDistanceTo(right);
    }

    public double heightDeg() {
        return bounds.decHeight();
    }

    /** Exact solid angle of the cell in square degrees. */
    public double areaSqDeg() {
        final var sinTop = FastMath.sin(FastMath.toRadians(bounds.decTop()));
        final var sinBottom = FastMath.sin(FastMath.toRadians(bounds.decBottom()));
        final var steradians = FastMath.toRadians(bounds.raWidth()) * (sinTop - sinBottom);
        return steradians * SQ_DEG_PER_STERADIAN;
    }

    /**
     * Whether the point belongs to this cell, using the same convention as
     * {@link CelestialSphereIndex#getCellAt}: Dec upper bound inclusive, RA left
     * bound inclusive, and the poles owned by cell 0 of the polar bands.
     */
    public boolean contains(final EquatorialCoords coords) {
        final var dec = coords.dec();
        final var decInside = (dec > bounds.decBottom() && dec <= bounds.decTop())
                || (dec == -90.0 && bounds.decBottom() == -90.0);
        if (!decInside) {
            return false;
        }
        if (FastMath.abs(dec) == 90.0) {
            return cellIndex == 0;
        }
        return bounds.containsRa(coords.ra());
    }

    /**
     * Splits the cell into an {@code n x n} grid of equal RA/Dec rectangles, row by row from the top.
     */
    public List<RaDecBounds> subDivide(final int n) {
        final var raStep = bounds.raWidth() / n;
        final var decStep = bounds.decHeight() / n;
        final var parts = new ArrayList<RaDecBounds>(n * n);
        for (var row = 0; row < n; row++) {
            final var top = bounds.decTop() - row * decStep;
            final var bottom = row == n - 1 ? bounds.decBottom() : top - decStep;
            for (var col = 0; col < n; col++) {
                final var left = (bounds.raLeft() + col * raStep) % 360.0;
                final var right = col == n - 1
                        ? bounds.raRight()
                        : wrapRight(bounds.raLeft() + (col + 1) * raStep);
                parts.add(new RaDecBounds(left, right, top, bottom));
            }
        }
        return parts;
    }

    private static double wrapRight(final double ra) {
        return ra > 360.0 ? ra - 360.0 : ra;
    }
}
