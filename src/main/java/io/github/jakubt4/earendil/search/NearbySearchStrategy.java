package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Searches the assumed center first, then a pattern of overlapping circles covering
 * {@code searchAreaRadius} around it, nearest circles first.
 *
 * <p>Circles are laid out in Dec rows spaced by the field radius; each row gets enough
 * circles of the field radius to cover its parallel, with every other row shifted by
 * half a step so neighbouring rows interleave.
 */
public class NearbySearchStrategy implements SearchStrategy {

    private final EquatorialCoords center;
    private final double fieldRadius;
    private final double searchAreaRadius;
    private final DensityOffsets offsets;
    private final boolean parallel;

    public NearbySearchStrategy(final EquatorialCoords center, final double fieldRadius,
                                final double searchAreaRadius, final DensityOffsets offsets,
                                final boolean parallel) {
        if (!(fieldRadius > 0.0) || fieldRadius > 30.0) {
            throw new SolverInputException("Field radius must be in (0, 30], was " + fieldRadius);
        }
        if (!(searchAreaRadius > 0.0)) {
            throw new SolverInputException("Search area radius must be positive, was " + searchAreaRadius);
        }
        this.center = center;
        this.fieldRadius = fieldRadius;
        this.searchAreaRadius = searchAreaRadius;
        this.offsets = offsets;
        this.parallel = parallel;
    }

    public NearbySearchStrategy(final EquatorialCoords center, final double fieldRadius, final double searchAreaRadius) {
        this(center, fieldRadius, searchAreaRadius, DensityOffsets.DEFAULT, true);
    }

    @Override
    public List<SearchRun> searchRuns() {
        final var candidates = new ArrayList<Candidate>();
        candidates.add(new Candidate(0.0, new SearchRun(center, fieldRadius, offsets)));

        final var minDec = FastMath.max(center.dec() - searchAreaRadius, -90.0);
        final var maxDec = FastMath.min(center.dec() + searchAreaRadius, 90.0);
        var row = 0;
        for (var dec = minDec; dec <= maxDec; dec += fieldRadius, row++) {
            final var circumference = FastMath.cos(FastMath.toRadians(dec)) * 360.0;
            final var circles = (int) FastMath.ceil(circumference / (2.0 * fieldRadius)) + 1;
            final var raStep = 360.0 / circles;
            final var raOffset = (row % 2) * 0.5 * raStep;
            for (var i = 0; i < circles; i++) {
                final var runCenter = EquatorialCoords.normalized(raOffset + i * raStep, dec);
                final var distance = runCenter.angularDistanceTo(center);
                if (distance < searchAreaRadius) {
                    candidates.add(new Candidate(distance, new SearchRun(runCenter, fieldRadius, offsets)));
                }
            }
        }

        candidates.sort(Comparator.comparingDouble(Candidate::distance));
        return candidates.stream().map(Candidate::run).toList();
    }

    @Override
    public boolean useParallelism() {
        return parallel;
    }

    private record Candidate(double distance, SearchRun run) {
    }
}
