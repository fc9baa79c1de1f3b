package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.sky.EquatorialCoords;

import java.util.Arrays;
import java.util.Objects;

/**
 * A catalog quad: the scale-free shape of four neighbouring stars and where it sits on the sky.
 *
 * <p>Equality compares the ratio values, so the same quad read from two passes or two
 * overlapping units collapses to one entry in a set.
 *
 * @param ratios          the five smaller pairwise distances divided by the largest, ascending
 * @param largestDistance largest pairwise distance, degrees
 * @param midpoint        spherical mean of the four stars
 */
public record QuadRecord(float[] ratios, float largestDistance, EquatorialCoords midpoint) {

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuadRecord other)) {
            return false;
        }
        return Float.compare(largestDistance, other.largestDistance) == 0
                && Arrays.equals(ratios, other.ratios)
                && midpoint.equals(other.midpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(ratios), largestDistance, midpoint);
    }

    @Override
    public String toString() {
        return "QuadRecord[ratios=" + Arrays.toString(ratios) + ", largestDistance=" + largestDistance
                + ", midpoint=" + midpoint + "]";
    }
}
