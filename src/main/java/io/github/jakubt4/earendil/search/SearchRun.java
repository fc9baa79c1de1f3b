package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.EquatorialCoords;

/**
 * A search circle proposed by a {@link SearchStrategy}.
 *
 * @param center  circle center
 * @param radius  circle radius in degrees, also the assumed field radius of the image
 * @param offsets density passes to include around the estimated density
 */
public record SearchRun(EquatorialCoords center, double radius, DensityOffsets offsets) {

    public SearchRun {
        if (!(radius > 0.0) || radius > 180.0) {
            throw new SolverInputException("Search radius must be in (0, 180], was " + radius);
        }
    }

    @Override
    public String toString() {
        return String.format("[%s r=%.3f]", center, radius);
    }
}
