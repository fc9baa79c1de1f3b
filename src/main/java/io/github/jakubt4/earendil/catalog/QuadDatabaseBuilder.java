package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.sky.Cell;
import io.github.jakubt4.earendil.sky.CelestialSphereIndex;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import io.github.jakubt4.earendil.sky.SkyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Turns the per-cell star files written by {@link StarExtractor} into quad cell files.
 *
 * <p>Each cell gets several passes of increasing density. Pass {@code p} keeps the
 * brightest {@code starsPerSqDeg * passFactor^p * cellArea} stars, splits the cell into
 * {@code k x k} sub-cells with {@code k = clamp(stars / 2000, 2, 12)} so that quads stay
 * local, and forms quads inside every sub-cell. Cells are built in parallel, one unit per
 * cell on the {@link ConcurrencyScheduler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuadDatabaseBuilder {

    private static final int STARS_PER_SUBDIVISION = 2000;
    private static final int MIN_SUBDIVISIONS = 2;
    private static final int MAX_SUBDIVISIONS = 12;

    private final CelestialSphereIndex sphereIndex;
    private final ConcurrencyScheduler scheduler;

    /**
     * @param passCount     maximum passes per cell; passes that would repeat the previous star set are skipped
     * @param starsPerSqDeg star density of the first pass
     * @param passFactor    density growth between consecutive passes
     */
    public record BuildOptions(int passCount, double starsPerSqDeg, double passFactor) {

        public static final BuildOptions DEFAULT = new BuildOptions(10, 16.0, FastMath.sqrt(2.0));

        public BuildOptions {
            if (passCount < 1 || passCount > QuadCatalogFormat.MAX_PASSES) {
                throw new SolverInputException("Pass count must be in [1, " + QuadCatalogFormat.MAX_PASSES
                        + "], was " + passCount);
            }
            if (!(starsPerSqDeg > 0.0) || !(passFactor >= 1.0)) {
                throw new SolverInputException("Invalid density settings: starsPerSqDeg=" + starsPerSqDeg
                        + ", passFactor=" + passFactor);
            }
        }
    }

    /**
     * @param cellsBuilt   cell files written
     * @param quadsWritten quad records across all cells and passes
     * @param failedCells  star files that could not be turned into a cell file
     */
    public record BuildReport(int cellsBuilt, long quadsWritten, List<Path> failedCells) {
    }

    private record PlacedStar(StarRecord star, Vector3D vector) {
    }

    /**
     * Builds one {@code <cellId>.qdb} per {@code <cellId>.stars} file found in {@code starsDir}.
     * A failing cell is logged and reported; the others are still built.
     *
     * @throws UncheckedIOException if either directory cannot be accessed
     */
    public BuildReport build(final Path starsDir, final Path outDir, final BuildOptions options) {
        final List<Path> starFiles;
        try (var listing = Files.list(starsDir)) {
            Files.createDirectories(outDir);
            starFiles = listing
                    .filter(p -> p.getFileName().toString().endsWith(StarRecord.FILE_EXTENSION))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot prepare build from " + starsDir + " to " + outDir, e);
        }
        log.info("Building quad database — {} star files, {} passes, {} stars/deg², factor {}",
                starFiles.size(), options.passCount(), options.starsPerSqDeg(), options.passFactor());

        final var futures = new LinkedHashMap<Path, CompletableFuture<CellFileDescriptor>>();
        for (final var file : starFiles) {
            futures.put(file, scheduler.submit(() -> buildCell(file, outDir, options)));
        }

        var built = 0;
        var quads = 0L;
        final var failed = new ArrayList<Path>();
        for (final Map.Entry<Path, CompletableFuture<CellFileDescriptor>> entry : futures.entrySet()) {
            try {
                final var descriptor = entry.getValue().join();
                built++;
                quads += descriptor.passes().stream().mapToLong(PassDescriptor::recordCount).sum();
            } catch (final CompletionException e) {
                log.error("Failed to build cell from {}: {}", entry.getKey().getFileName(), e.getCause().getMessage());
                failed.add(entry.getKey());
            }
        }
        log.info("Quad database built — {} cells, {} quads, {} failures", built, quads, failed.size());
        return new BuildReport(built, quads, List.copyOf(failed));
    }

    /**
     * Builds the cell file for one star file.
     *
     * @throws SolverInputException if the file name is not a known cell id
     */
    CellFileDescriptor buildCell(final Path starFile, final Path outDir, final BuildOptions options) {
        final var fileName = starFile.getFileName().toString();
        final var cell = sphereIndex.getCellById(
                fileName.substring(0, fileName.length() - StarRecord.FILE_EXTENSION.length()));

        final var stars = new ArrayList<StarRecord>();
        var misplaced = 0;
        for (final var star : StarRecord.readAll(starFile)) {
            if (cell.contains(star.coords())) {
                stars.add(star);
            } else {
                misplaced++;
            }
        }
        if (misplaced > 0) {
            log.warn("{}: ignored {} stars outside the cell", cell.cellId(), misplaced);
        }
        stars.sort(Comparator.comparingDouble(StarRecord::magnitude));

        final var area = cell.areaSqDeg();
        final var passes = new ArrayList<QuadCatalogWriter.PassData>();
        var previousCount = -1;
        for (var p = 0; p < options.passCount(); p++) {
            final var target = options.starsPerSqDeg() * FastMath.pow(options.passFactor(), p) * area;
            final var count = (int) FastMath.min(stars.size(), FastMath.round(target));
            if (count == previousCount) {
                break;
            }
            previousCount = count;

            final var quads = formQuads(cell, stars.subList(0, count));
            passes.add(new QuadCatalogWriter.PassData((float) (quads.size() / area), quads));
            log.debug("{} pass {} — {} stars, {} quads", cell.cellId(), p, count, quads.size());
        }

        final var target = outDir.resolve(cell.cellId() + QuadCatalogFormat.FILE_EXTENSION);
        return QuadCatalogWriter.write(target, cell.bandIndex(), cell.cellIndex(), passes);
    }

    private static List<QuadRecord> formQuads(final Cell cell, final List<StarRecord> stars) {
        final var n = (int) FastMath.max(MIN_SUBDIVISIONS,
                FastMath.min(MAX_SUBDIVISIONS, stars.size() / STARS_PER_SUBDIVISION));
        final var bounds = cell.bounds();
        final var raStep = bounds.raWidth() / n;
        final var decStep = bounds.decHeight() / n;

        final var subCells = new ArrayList<List<PlacedStar>>(n * n);
        for (var i = 0; i < n * n; i++) {
            subCells.add(new ArrayList<>());
        }
        for (final var star : stars) {
            var raOffset = star.ra() - bounds.raLeft();
            if (raOffset < 0.0) {
                raOffset += 360.0;
            }
            final var col = FastMath.min(n - 1, (int) (raOffset / raStep));
            final var row = FastMath.max(0, FastMath.min(n - 1, (int) ((bounds.decTop() - star.dec()) / decStep)));
            subCells.get(row * n + col).add(new PlacedStar(star, star.coords().toVector()));
        }

        final var quads = new ArrayList<QuadRecord>();
        for (final var members : subCells) {
            final var seen = new HashSet<QuadFormer.StarSetKey>();
            final var formed = QuadFormer.form(members,
                    (a, b) -> FastMath.toDegrees(Vector3D.angle(a.vector(), b.vector())));
            for (final var quad : formed) {
                if (!seen.add(quad.key())) {
                    continue;
                }
                final var corners = new ArrayList<EquatorialCoords>(4);
                for (final var index : quad.starIndices()) {
                    corners.add(members.get(index).star().coords());
                }
                quads.add(new QuadRecord(quad.ratios(), (float) quad.largestDistance(), SkyMath.sphericalMean(corners)));
            }
        }
        return quads;
    }
}
