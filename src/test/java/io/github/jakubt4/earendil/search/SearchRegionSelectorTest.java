package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.catalog.CellPass;
import io.github.jakubt4.earendil.catalog.QuadDatabase;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.CelestialSphereIndex;
import io.github.jakubt4.earendil.sky.Cell;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import io.github.jakubt4.earendil.sky.RaDecBounds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SearchRegionSelectorTest {

    private final CelestialSphereIndex sphereIndex = new CelestialSphereIndex();
    private QuadDatabase quadDatabase;
    private SearchRegionSelector selector;

    @BeforeEach
    void setUp() {
        quadDatabase = mock(QuadDatabase.class);
        when(quadDatabase.passesFor(anyString())).thenReturn(List.of());
        selector = new SearchRegionSelector(sphereIndex, quadDatabase);
    }

    @ParameterizedTest
    @CsvSource({
            "8.0,  355.0, -25.0, b10c00, true",
            "15.0, 250.0,  20.0, b08c25, true",
            "10.0,  50.0,  30.0, b02c01, false",
            "8.0,    0.0,   0.0, b09c35, true",
            "15.0, 125.0,  80.0, b01c04, true",
            "5.0,  125.0,  80.0, b01c05, false"
    })
    void decidesWhetherCellIsInSearchRadius(final double radius, final double ra, final double dec,
                                            final String cellId, final boolean expected) {
        final var cell = sphereIndex.getCellById(cellId);

        assertThat(selector.isCellInSearchRadius(cell, new EquatorialCoords(ra, dec), radius)).isEqualTo(expected);
    }

    @Test
    void searchCircleAcrossRaSeamSelectsCellsOnBothSides() {
        final var cells = selector.cellsInSearchRadius(new EquatorialCoords(359.5, 5.0), 1.0);

        assertThat(cells).extracting(Cell::cellId).containsExactlyInAnyOrder("b08c00", "b08c35");
    }

    @Test
    void searchCircleReachingPoleSelectsWholePolarBand() {
        final var cells = selector.cellsInSearchRadius(new EquatorialCoords(10.0, 89.0), 2.0);

        assertThat(cells).extracting(Cell::cellId).containsExactlyInAnyOrder("b00c00", "b00c01", "b00c02");
    }

    @Test
    void centerInsideCellIsAtDistanceZero() {
        final var cell = sphereIndex.getCellById("b05c10");

        assertThat(selector.distanceToCell(cell, new EquatorialCoords(125.0, 35.0), 0.5)).isZero();
        assertThat(selector.isCellInSearchRadius(cell, new EquatorialCoords(125.0, 35.0), 0.001)).isTrue();
    }

    @Test
    void cellWrappingRaSeamIsMeasuredAcrossTheSeam() {
        final var wrapping = new Cell("wrapping", 8, 0, new RaDecBounds(350.0, 10.0, 10.0, 0.0));

        assertThat(selector.distanceToCell(wrapping, new EquatorialCoords(5.0, 5.0), 1.0)).isZero();
        assertThat(selector.distanceToCell(wrapping, new EquatorialCoords(355.0, 5.0), 1.0)).isZero();
        assertThat(selector.distanceToCell(wrapping, new EquatorialCoords(12.0, 5.0), 3.0))
                .isCloseTo(new EquatorialCoords(12.0, 5.0).angularDistanceTo(new EquatorialCoords(10.0, 5.0)), within(1e-9));
        assertThat(selector.isCellInSearchRadius(wrapping, new EquatorialCoords(348.5, 5.0), 2.0)).isTrue();
    }

    @Test
    void centerEquallyFarFromBothEdgesMeasuresToRightEdge() {
        final var cell = sphereIndex.getCellById("b08c05");
        final var opposite = new EquatorialCoords(235.0, 5.0);

        assertThat(cell.bounds().raLeft()).isEqualTo(50.0);
        assertThat(cell.bounds().raRight()).isEqualTo(60.0);
        assertThat(selector.distanceToCell(cell, opposite, 10.0))
                .isEqualTo(opposite.angularDistanceTo(EquatorialCoords.normalized(60.0, 5.0)));
        assertThat(selector.isCellInSearchRadius(cell, opposite, 10.0)).isFalse();
    }

    @Test
    void rejectsNonPositiveRadius() {
        final var center = new EquatorialCoords(10.0, 10.0);

        assertThatThrownBy(() -> selector.cellsInSearchRadius(center, 0.0)).isInstanceOf(SolverInputException.class);
        assertThatThrownBy(() -> selector.cellsInSearchRadius(center, -1.0)).isInstanceOf(SolverInputException.class);
    }

    @Test
    void selectsPassClosestToDensityWithOffsets() {
        final var passes = passes("b08c05", 1f, 2f, 4f, 8f, 16f);

        assertThat(SearchRegionSelector.selectPasses(passes, 5.0, DensityOffsets.DEFAULT))
                .extracting(CellPass::density).containsExactly(2f, 4f, 8f);
        assertThat(SearchRegionSelector.selectPasses(passes, 5.0, new DensityOffsets(0, 3)))
                .extracting(CellPass::density).containsExactly(4f, 8f, 16f);
        assertThat(SearchRegionSelector.selectPasses(passes, 100.0, DensityOffsets.DEFAULT))
                .extracting(CellPass::density).containsExactly(8f, 16f);
        assertThat(SearchRegionSelector.selectPasses(List.of(), 5.0, DensityOffsets.DEFAULT)).isEmpty();
    }

    @Test
    void selectUnitsPairsCellsInRangeWithTheirPasses() {
        when(quadDatabase.passesFor("b08c05")).thenReturn(passes("b08c05", 1f, 2f, 4f));
        when(quadDatabase.passesFor("b08c04")).thenReturn(passes("b08c04", 3f));

        final var center = new EquatorialCoords(50.2, 5.0);
        final var units = selector.selectUnits(center, 1.0, 2.0, DensityOffsets.symmetric(0));

        assertThat(units).extracting(unit -> unit.cell().cellId()).containsExactly("b08c04", "b08c05");
        assertThat(units).extracting(unit -> unit.pass().density()).containsExactly(3f, 2f);
        assertThat(units).allSatisfy(unit -> {
            assertThat(unit.center()).isEqualTo(center);
            assertThat(unit.radius()).isEqualTo(1.0);
        });
    }

    private static List<CellPass> passes(final String cellId, final float... densities) {
        final var passes = new ArrayList<CellPass>();
        for (var i = 0; i < densities.length; i++) {
            passes.add(new CellPass(cellId, null, i, densities[i], 100));
        }
        return passes;
    }
}
