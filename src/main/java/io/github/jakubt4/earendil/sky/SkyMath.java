package io.github.jakubt4.earendil.sky;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.util.Collection;

/**
 * Small spherical helpers shared by the index, the catalog builder and the solver.
 */
public final class SkyMath {

    private SkyMath() {
    }

    /**
     * Circular difference between two angles in degrees, in {@code [0, 180]}.
     * {@code angleDiff(355, 5) == 10}.
     */
    public static double angleDiff(final double a, final double b) {
        var diff = (a - b + 180.0) % 360.0;
        if (diff < 0.0) {
            diff += 360.0;
        }
        return FastMath.abs(diff - 180.0);
    }

    /** Normalised vector sum of the positions; the spherical mean for points within a hemisphere. */
    public static EquatorialCoords sphericalMean(final Collection<EquatorialCoords> points) {
        var sum = Vector3D.ZERO;
        for (final var point : points) {
            sum = sum.add(point.toVector());
        }
        return EquatorialCoords.fromVector(sum.normalize());
    }
}
