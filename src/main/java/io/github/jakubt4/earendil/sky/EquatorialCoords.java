package io.github.jakubt4.earendil.sky;

import io.github.jakubt4.earendil.exception.SolverInputException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * J2000 equatorial position in degrees.
 *
 * @param ra  right ascension, {@code [0, 360)}
 * @param dec declination, {@code [-90, 90]}
 * @throws SolverInputException if either component is outside its range or not finite
 */
public record EquatorialCoords(double ra, double dec) {

    public EquatorialCoords {
        if (!Double.isFinite(ra) || ra < 0.0 || ra >= 360.0) {
            throw new SolverInputException("RA must be in [0, 360), was " + ra);
        }
        if (!Double.isFinite(dec) || dec < -90.0 || dec > 90.0) {
            throw new SolverInputException("Dec must be in [-90, 90], was " + dec);
        }
    }

    /**
     * Wraps RA into {@code [0, 360)} and clamps Dec into {@code [-90, 90]}.
     * Used for values produced by arithmetic, where small excursions are expected.
     */
    public static EquatorialCoords normalized(final double ra, final double dec) {
        if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
            throw new SolverInputException("Coordinates must be finite, was (" + ra + ", " + dec + ")");
        }
        var wrapped = ra % 360.0;
        if (wrapped < 0.0) {
            wrapped += 360.0;
        }
        if (wrapped >= 360.0) {
            wrapped = 0.0;
        }
        return new EquatorialCoords(wrapped, FastMath.max(-90.0, FastMath.min(90.0, dec)));
    }

    public static EquatorialCoords fromVector(final Vector3D vector) {
        return normalized(FastMath.toDegrees(vector.getAlpha()), FastMath.toDegrees(vector.getDelta()));
    }

    /** Unit vector pointing at this position. */
    public Vector3D toVector() {
        return new Vector3D(FastMath.toRadians(ra), FastMath.toRadians(dec));
    }

    /** Great-circle distance in degrees. */
    public double angularDistanceTo(final EquatorialCoords other) {
        return FastMath.toDegrees(Vector3D.angle(toVector(), other.toVector()));
    }

    /**
     * Gnomonic (tangent plane) projection of this position around {@code center}.
     *
     * @return standard coordinates in degrees
     */
    public StandardCoords toStandard(final EquatorialCoords center) {
        final var dec0 = FastMath.toRadians(center.dec);
        final var decRad = FastMath.toRadians(dec);
        final var dRa = FastMath.toRadians(ra - center.ra);

        final var cosC = FastMath.sin(dec0) * FastMath.sin(decRad)
                + FastMath.cos(dec0) * FastMath.cos(decRad) * FastMath.cos(dRa);
        final var xi = FastMath.cos(decRad) * FastMath.sin(dRa) / cosC;
        final var eta = (FastMath.cos(dec0) * FastMath.sin(decRad)
                - FastMath.sin(dec0) * FastMath.cos(decRad) * FastMath.cos(dRa)) / cosC;
        return new StandardCoords(FastMath.toDegrees(xi), FastMath.toDegrees(eta));
    }

    /** Inverse of {@link #toStandard}: deprojects standard coordinates (degrees) around {@code center}. */
    public static EquatorialCoords fromStandard(final EquatorialCoords center, final double xiDeg, final double etaDeg) {
        final var dec0 = FastMath.toRadians(center.dec);
        final var xi = FastMath.toRadians(xiDeg);
        final var eta = FastMath.toRadians(etaDeg);

        final var denominator = FastMath.cos(dec0) - eta * FastMath.sin(dec0);
        final var ra = center.ra + FastMath.toDegrees(FastMath.atan2(xi, denominator));
        final var dec = FastMath.toDegrees(FastMath.atan2(
                FastMath.sin(dec0) + eta * FastMath.cos(dec0),
                FastMath.sqrt(xi * xi + denominator * denominator)));
        return normalized(ra, dec);
    }

    @Override
    public String toString() {
        return String.format("(%.5f, %.5f)", ra, dec);
    }
}
