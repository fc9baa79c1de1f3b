package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Sweeps the whole sky with no prior position, starting with large search circles and
 * halving the radius after every full sweep until {@code minRadius} is reached.
 *
 * <p>Each sweep covers four quarter-skies: both hemispheres on both RA halves, in the
 * configured order. Rows inside a quarter go from the equator to the pole.
 */
public class BlindSearchStrategy implements SearchStrategy {

    public static final double DEFAULT_START_RADIUS = 22.5;
    public static final double DEFAULT_MIN_RADIUS = DEFAULT_START_RADIUS / 32.0;

    public enum DecOrder { NORTH_FIRST, SOUTH_FIRST }

    public enum RaOrder { EAST_FIRST, WEST_FIRST }

    private final double startRadius;
    private final double minRadius;
    private final DecOrder decOrder;
    private final RaOrder raOrder;
    private final DensityOffsets offsets;

    public BlindSearchStrategy(final double startRadius, final double minRadius, final DecOrder decOrder,
                               final RaOrder raOrder, final DensityOffsets offsets) {
        if (!(minRadius > 0.0) || minRadius > startRadius) {
            throw new SolverInputException("Need 0 < minRadius <= startRadius, were " + minRadius + ", " + startRadius);
        }
        this.startRadius = startRadius;
        this.minRadius = minRadius;
        this.decOrder = decOrder;
        this.raOrder = raOrder;
        this.offsets = offsets;
    }

    public BlindSearchStrategy() {
        this(DEFAULT_START_RADIUS, DEFAULT_MIN_RADIUS, DecOrder.NORTH_FIRST, RaOrder.EAST_FIRST, DensityOffsets.DEFAULT);
    }

    @Override
    public List<SearchRun> searchRuns() {
        final var runs = new ArrayList<SearchRun>();
        for (var radius = startRadius; radius >= minRadius; radius /= 2.0) {
            for (var quarter = 0; quarter < 4; quarter++) {
                final var southern = (decOrder == DecOrder.SOUTH_FIRST) == (quarter < 2);
                final var shifted = (raOrder == RaOrder.WEST_FIRST) == (quarter % 2 == 0);
                addQuarter(runs, radius, southern, shifted, quarter >= 2);
            }
        }
        return runs;
    }

    private void addQuarter(final List<SearchRun> runs, final double radius, final boolean southern,
                            final boolean shifted, final boolean skipEquator) {
        var row = 0;
        var dec = 0.0;
        var complete = false;
        while (!complete) {
            if (dec >= 90.0) {
                dec = 90.0;
                complete = true;
            }
            if (!(skipEquator && row == 0)) {
                final var halfCircumference = FastMath.cos(FastMath.toRadians(dec)) * 180.0;
                final var circles = (int) FastMath.ceil(halfCircumference / (2.0 * radius)) + 1;
                final var raStep = 180.0 / circles;
                final var raOffset = (row % 2) * 0.5 * raStep;
                for (var i = 0; i < circles; i++) {
                    final var ra = (raOffset + i * raStep) % 180.0 + (shifted ? 180.0 : 0.0);
                    runs.add(new SearchRun(EquatorialCoords.normalized(ra, southern ? -dec : dec), radius, offsets));
                }
            }
            dec += radius;
            row++;
        }
    }
}
