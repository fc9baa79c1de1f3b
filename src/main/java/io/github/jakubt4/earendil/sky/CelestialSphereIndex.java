package io.github.jakubt4.earendil.sky;

import io.github.jakubt4.earendil.exception.SolverInputException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed partition of the celestial sphere into 406 cells in 18 declination bands.
 *
 * <p>Band limits are chosen so that each cell covers roughly the same solid angle:
 * the RA width of a cell grows toward the poles to compensate for the
 * {@code cos(dec)} shrinkage of a degree of RA. Grid layout (north to south):
 * <pre>
 *   band  dec range              cell RA width  cells
 *   b00   ( 80.1375,  90.0   ]   120             3
 *   b01   ( 70.2010,  80.1375]    40             9
 *   b02   ( 60.1113,  70.2010]    24            15
 *   b03   ( 50.2170,  60.1113]    18            20
 *   b04   ( 40.5602,  50.2170]    15            24
 *   b05   ( 30.1631,  40.5602]    12            30
 *   b06   ( 20.7738,  30.1631]    12            30
 *   b07   ( 10.2148,  20.7738]    10            36
 *   b08   (  0.0,     10.2148]    10            36
 *   b09..b17 mirror the above southward; b17 also owns Dec = -90
 * </pre>
 *
 * <p>The instance is immutable and safe to share between threads.
 */
@Slf4j
@Component
public class CelestialSphereIndex {

    private static final double[] NORTHERN_LIMITS = {90.0, 80.1375, 70.2010, 60.1113, 50.2170, 40.5602, 30.1631, 20.7738, 10.2148, 0.0};
    private static final double[] NORTHERN_CELL_WIDTHS = {120, 40, 24, 18, 15, 12, 12, 10, 10};

    private final List<Band> bands;
    private final List<Cell> cells;
    private final List<List<Cell>> cellsByBand;
    private final Map<String, Cell> cellsById;

    public CelestialSphereIndex() {
        final var bandList = new ArrayList<Band>();
        final var northernCount = NORTHERN_CELL_WIDTHS.length;
        for (var i = 0; i < northernCount; i++) {
            bandList.add(new Band(i, NORTHERN_LIMITS[i + 1], NORTHERN_LIMITS[i], NORTHERN_CELL_WIDTHS[i]));
        }
        for (var i = 0; i < northernCount; i++) {
            final var mirror = northernCount - 1 - i;
            bandList.add(new Band(northernCount + i,
                    -NORTHERN_LIMITS[mirror], -NORTHERN_LIMITS[mirror + 1], NORTHERN_CELL_WIDTHS[mirror]));
        }

        final var allCells = new ArrayList<Cell>();
        final var byBand = new ArrayList<List<Cell>>();
        final var byId = new LinkedHashMap<String, Cell>();
        for (final var band : bandList) {
            final var bandCells = new ArrayList<Cell>(band.cellCount());
            for (var c = 0; c < band.cellCount(); c++) {
                final var bounds = new RaDecBounds(
                        c * band.cellRaWidth(), (c + 1) * band.cellRaWidth(), band.decTop(), band.decBottom());
                final var cell = new Cell(Cell.formatId(band.index(), c), band.index(), c, bounds);
                bandCells.add(cell);
                allCells.add(cell);
                byId.put(cell.cellId(), cell);
            }
            byBand.add(Collections.unmodifiableList(bandCells));
        }

        this.bands = Collections.unmodifiableList(bandList);
        this.cells = Collections.unmodifiableList(allCells);
        this.cellsByBand = Collections.unmodifiableList(byBand);
        this.cellsById = Collections.unmodifiableMap(byId);
        log.debug("Sky index built — {} bands, {} cells", bands.size(), cells.size());
    }

    /** Every cell, band by band from north to south, RA ascending within a band. */
    public List<Cell> cells() {
        return cells;
    }

    public List<Band> bands() {
        return bands;
    }

    /**
     * Returns the single cell owning the position.
     *
     * <p>Dec upper bounds are inclusive, so a point on a band boundary belongs to
     * the band south of the line (the one it is the upper limit of); Dec = -90 belongs to the southernmost band.
     * Both poles resolve to cell 0 of their band regardless of RA.
     */
    public Cell getCellAt(final EquatorialCoords coords) {
        final var band = bandFor(coords.dec());
        if (FastMath.abs(coords.dec()) == 90.0) {
            return cellsByBand.get(band.index()).get(0);
        }
        final var index = (int) FastMath.floor(coords.ra() / band.cellRaWidth());
        final var bandCells = cellsByBand.get(band.index());
        return bandCells.get(FastMath.min(index, bandCells.size() - 1));
    }

    /**
     * @throws SolverInputException if RA or Dec is outside its valid range
     */
    public Cell getCellAt(final double ra, final double dec) {
        return getCellAt(new EquatorialCoords(ra, dec));
    }

    public Cell getCellById(final String cellId) {
        final var cell = cellsById.get(cellId);
        if (cell == null) {
            throw new SolverInputException("Unknown cell id: " + cellId);
        }
        return cell;
    }

    public Cell getCell(final int bandIndex, final int cellIndex) {
        if (bandIndex < 0 || bandIndex >= cellsByBand.size()) {
            throw new SolverInputException("Band index out of range: " + bandIndex);
        }
        final var bandCells = cellsByBand.get(bandIndex);
        if (cellIndex < 0 || cellIndex >= bandCells.size()) {
            throw new SolverInputException("Cell index " + cellIndex + " out of range for band " + bandIndex);
        }
        return bandCells.get(cellIndex);
    }

    private Band bandFor(final double dec) {
        for (final var band : bands) {
            if (band.containsDec(dec)) {
                return band;
            }
        }
        throw new SolverInputException("Dec outside the sky grid: " + dec);
    }
}
