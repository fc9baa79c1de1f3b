package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.catalog.CellPass;
import io.github.jakubt4.earendil.catalog.QuadDatabase;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.CelestialSphereIndex;
import io.github.jakubt4.earendil.sky.Cell;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import io.github.jakubt4.earendil.sky.SkyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a search circle down to the (cell, pass) units worth scanning.
 *
 * <p>Cells are accepted or rejected as a whole by comparing the search radius with
 * the distance from the circle center to an approximate nearest point of the cell:
 * <ol>
 *   <li>cells whose Dec range misses {@code [dec - r, dec + r]} are rejected outright;</li>
 *   <li>the nearest Dec is the center Dec clamped into the cell's Dec range, or the
 *       pole itself when both the circle and the cell reach that pole;</li>
 *   <li>the nearest RA is the center RA if it lies strictly inside the cell's RA range,
 *       otherwise the closer RA edge measured circularly across the 0/360 seam;</li>
 *   <li>a nearest point equal to the center is in range, otherwise its great-circle
 *       distance must be strictly below the radius.</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchRegionSelector {

    private final CelestialSphereIndex sphereIndex;
    private final QuadDatabase quadDatabase;

    /**
     * Units for every cell in range and every pass within {@code offsets} steps of the
     * pass whose density is closest to {@code quadsPerSqDeg}.
     *
     * @return units in sky-grid order; empty when no cell with data is in range
     * @throws SolverInputException if the radius is not positive
     */
    public List<SearchUnit> selectUnits(final EquatorialCoords center, final double radius,
                                        final double quadsPerSqDeg, final DensityOffsets offsets) {
        final var units = new ArrayList<SearchUnit>();
        for (final var cell : cellsInSearchRadius(center, radius)) {
            for (final var pass : selectPasses(quadDatabase.passesFor(cell.cellId()), quadsPerSqDeg, offsets)) {
                units.add(new SearchUnit(cell, pass, center, radius));
            }
        }
        log.debug("Search {} r={} density={} -> {} units", center, radius, quadsPerSqDeg, units.size());
        return units;
    }

    public List<Cell> cellsInSearchRadius(final EquatorialCoords center, final double radius) {
        if (!(radius > 0.0)) {
            throw new SolverInputException("Search radius must be positive, was " + radius);
        }
        return sphereIndex.cells().stream()
                .filter(cell -> isCellInSearchRadius(cell, center, radius))
                .toList();
    }

    public boolean isCellInSearchRadius(final Cell cell, final EquatorialCoords center, final double radius) {
        final var distance = distanceToCell(cell, center, radius);
        return distance == 0.0 || radius - distance > 0.0;
    }

    /**
     * Distance in degrees from the center to the cell's approximate nearest point, as used by
     * {@link #isCellInSearchRadius}. {@link Double#POSITIVE_INFINITY} when the Dec ranges do not overlap.
     */
    public double distanceToCell(final Cell cell, final EquatorialCoords center, final double radius) {
        final var bounds = cell.bounds();
        final var searchTop = center.dec() + radius;
        final var searchBottom = center.dec() - radius;
        if (bounds.decBottom() > searchTop || bounds.decTop() < searchBottom) {
            return Double.POSITIVE_INFINITY;
        }

        final double nearestDec;
        if (searchTop >= 90.0 && bounds.decTop() == 90.0) {
            nearestDec = 90.0;
        } else if (searchBottom <= -90.0 && bounds.decBottom() == -90.0) {
            nearestDec = -90.0;
        } else {
            nearestDec = FastMath.max(bounds.decBottom(), FastMath.min(bounds.decTop(), center.dec()));
        }

        final double nearestRa;
        if (bounds.strictlyContainsRa(center.ra())) {
            nearestRa = center.ra();
        } else {
            final var toLeft = SkyMath.angleDiff(center.ra(), bounds.raLeft());
            final var toRight = SkyMath.angleDiff(center.ra(), bounds.raRight());
            // a tie goes to the right edge
            nearestRa = toLeft < toRight ? bounds.raLeft() : bounds.raRight();
        }

        if (nearestDec == center.dec() && nearestRa == center.ra()) {
            return 0.0;
        }
        return center.angularDistanceTo(EquatorialCoords.normalized(nearestRa, nearestDec));
    }

    /**
     * Picks the pass closest to the wanted density plus {@code offsets.lower()} passes below
     * and {@code offsets.higher()} above it, clamped to what the cell has.
     *
     * @param passes ascending density
     */
    static List<CellPass> selectPasses(final List<CellPass> passes, final double quadsPerSqDeg,
                                       final DensityOffsets offsets) {
        if (passes.isEmpty()) {
            return List.of();
        }
        var best = 0;
        var bestDiff = Double.MAX_VALUE;
        for (var i = 0; i < passes.size(); i++) {
            final var diff = FastMath.abs(passes.get(i).density() - quadsPerSqDeg);
            if (diff < bestDiff) {
                bestDiff = diff;
                best = i;
            }
        }
        final var from = FastMath.max(0, best - offsets.lower());
        final var to = FastMath.min(passes.size() - 1, best + offsets.higher());
        return passes.subList(from, to + 1);
    }
}
