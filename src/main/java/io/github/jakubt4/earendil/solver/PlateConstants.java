package io.github.jakubt4.earendil.solver;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.jakubt4.earendil.sky.StandardCoords;

/**
 * Affine map from pixel to standard coordinates (degrees):
 * <pre>
 *   xi  = a*x + b*y + c
 *   eta = d*x + e*y + f
 * </pre>
 */
public record PlateConstants(double a, double b, double c, double d, double e, double f) {

    public StandardCoords toStandard(final double x, final double y) {
        return new StandardCoords(a * x + b * y + c, d * x + e * y + f);
    }

    /** Pixel that maps to the projection center ({@code xi = eta = 0}). */
    public double[] referencePixel() {
        final var det = a * e - b * d;
        return new double[]{(b * f - c * e) / det, (c * d - a * f) / det};
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(a) && Double.isFinite(b) && Double.isFinite(c)
                && Double.isFinite(d) && Double.isFinite(e) && Double.isFinite(f);
    }
}
