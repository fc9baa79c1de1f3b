package io.github.jakubt4.earendil.solver;

/**
 * A star detected in the image.
 *
 * @param x          pixel column, 0 at the left edge
 * @param y          pixel row, 0 at the top edge
 * @param brightness detector-specific flux measure, larger is brighter
 * @param size       apparent size in pixels, 0 if unknown
 */
public record ImageStar(double x, double y, double brightness, double size) {

    public double distanceTo(final ImageStar other) {
        final var dx = x - other.x;
        final var dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
