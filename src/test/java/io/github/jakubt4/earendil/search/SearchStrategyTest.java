package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchStrategyTest {

    @Test
    void nearbySearchStartsAtApproximateCenterAndMovesOutward() {
        final var center = new EquatorialCoords(100.0, 30.0);
        final var strategy = new NearbySearchStrategy(center, 1.5, 10.0);

        final var runs = strategy.searchRuns();

        assertThat(runs.get(0).center()).isEqualTo(center);
        assertThat(runs).hasSizeGreaterThan(20);
        assertThat(runs).allSatisfy(run -> {
            assertThat(run.radius()).isEqualTo(1.5);
            assertThat(run.center().angularDistanceTo(center)).isLessThan(10.0);
            assertThat(run.offsets()).isEqualTo(DensityOffsets.DEFAULT);
        });
        for (var i = 2; i < runs.size(); i++) {
            assertThat(runs.get(i).center().angularDistanceTo(center))
                    .isGreaterThanOrEqualTo(runs.get(i - 1).center().angularDistanceTo(center));
        }
        assertThat(strategy.useParallelism()).isTrue();
    }

    @Test
    void nearbySearchAroundPoleStaysOnSphere() {
        final var center = new EquatorialCoords(10.0, 88.0);

        final var runs = new NearbySearchStrategy(center, 2.0, 5.0).searchRuns();

        assertThat(runs).isNotEmpty();
        assertThat(runs).allSatisfy(run -> assertThat(run.center().dec()).isBetween(-90.0, 90.0));
    }

    @Test
    void nearbySearchRejectsOversizedField() {
        final var center = new EquatorialCoords(100.0, 30.0);

        assertThatThrownBy(() -> new NearbySearchStrategy(center, 31.0, 40.0))
                .isInstanceOf(SolverInputException.class);
        assertThatThrownBy(() -> new NearbySearchStrategy(center, 0.0, 40.0))
                .isInstanceOf(SolverInputException.class);
    }

    @Test
    void blindSearchHalvesRadiusDownToMinimum() {
        final var runs = new BlindSearchStrategy().searchRuns();

        assertThat(runs.get(0).radius()).isEqualTo(BlindSearchStrategy.DEFAULT_START_RADIUS);
        assertThat(runs.get(runs.size() - 1).radius()).isEqualTo(BlindSearchStrategy.DEFAULT_MIN_RADIUS);
        assertThat(runs).extracting(SearchRun::radius).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(runs).extracting(SearchRun::radius).containsOnly(22.5, 11.25, 5.625, 2.8125, 1.40625, 0.703125);
    }

    @Test
    void blindSearchVisitsEquatorOnceAndBothPoles() {
        final var runs = new BlindSearchStrategy(22.5, 22.5, BlindSearchStrategy.DecOrder.NORTH_FIRST,
                BlindSearchStrategy.RaOrder.EAST_FIRST, DensityOffsets.DEFAULT).searchRuns();

        // dec 0: ceil(180 / 45) + 1 circles on each RA half
        assertThat(runs.stream().filter(run -> run.center().dec() == 0.0).count()).isEqualTo(10);
        assertThat(runs).anySatisfy(run -> assertThat(run.center().dec()).isEqualTo(90.0));
        assertThat(runs).anySatisfy(run -> assertThat(run.center().dec()).isEqualTo(-90.0));
        assertThat(runs.get(0).center().ra()).isLessThan(180.0);
        assertThat(runs.get(runs.size() - 1).center().dec()).isNegative();
    }

    @Test
    void blindSearchHonoursConfiguredOrder() {
        final var runs = new BlindSearchStrategy(22.5, 22.5, BlindSearchStrategy.DecOrder.SOUTH_FIRST,
                BlindSearchStrategy.RaOrder.WEST_FIRST, DensityOffsets.DEFAULT).searchRuns();

        assertThat(runs.get(0).center().ra()).isGreaterThanOrEqualTo(180.0);
        assertThat(runs.get(runs.size() - 1).center().dec()).isPositive();
    }

    @Test
    void searchRunRejectsInvalidRadius() {
        final var center = new EquatorialCoords(0.0, 0.0);

        assertThatThrownBy(() -> new SearchRun(center, 0.0, DensityOffsets.DEFAULT))
                .isInstanceOf(SolverInputException.class);
        assertThatThrownBy(() -> new SearchRun(center, 181.0, DensityOffsets.DEFAULT))
                .isInstanceOf(SolverInputException.class);
    }

    @Test
    void missingDensityOffsetsDefaultToOnePass() {
        assertThat(DensityOffsets.of(OptionalInt.empty(), OptionalInt.of(3))).isEqualTo(new DensityOffsets(1, 3));
        assertThat(DensityOffsets.of(OptionalInt.empty(), OptionalInt.empty())).isEqualTo(DensityOffsets.DEFAULT);
        assertThatThrownBy(() -> new DensityOffsets(-1, 0)).isInstanceOf(SolverInputException.class);
    }
}
