package io.github.jakubt4.earendil.solver;

import java.util.Arrays;

/**
 * A quad formed from image stars.
 *
 * @param ratios          the five smaller pairwise distances divided by the largest, ascending
 * @param largestDistance largest pairwise distance in pixels
 * @param midX            mean x of the four stars
 * @param midY            mean y of the four stars
 */
public record ImageQuad(float[] ratios, float largestDistance, double midX, double midY) {

    public double pixelDistanceTo(final ImageQuad other) {
        final var dx = midX - other.midX;
        final var dy = midY - other.midY;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return String.format("ImageQuad[%s, %.1f px @ (%.1f, %.1f)]", Arrays.toString(ratios), largestDistance, midX, midY);
    }
}
