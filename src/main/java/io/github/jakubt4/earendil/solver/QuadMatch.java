package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.catalog.QuadRecord;

/**
 * An image quad paired with a catalog quad of the same shape.
 */
public record QuadMatch(ImageQuad imageQuad, QuadRecord catalogQuad) {

    /** Pixels per degree implied by this pair alone. */
    public double scaleRatio() {
        return imageQuad.largestDistance() / catalogQuad.largestDistance();
    }
}
