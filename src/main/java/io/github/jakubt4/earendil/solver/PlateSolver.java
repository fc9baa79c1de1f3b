package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.catalog.QuadRecord;
import io.github.jakubt4.earendil.concurrent.CancellationSignal;
import io.github.jakubt4.earendil.concurrent.CancelledException;
import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import io.github.jakubt4.earendil.config.SolverProperties;
import io.github.jakubt4.earendil.exception.DegenerateSystemException;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.search.DensityOffsets;
import io.github.jakubt4.earendil.search.SearchRegionSelector;
import io.github.jakubt4.earendil.search.SearchRun;
import io.github.jakubt4.earendil.search.SearchUnit;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Core entry point: finds where on the sky a list of detected stars lies.
 *
 * <p>The image stars are turned into quads once. The search strategy's runs are then
 * processed in batches; every run is split by {@link SearchRegionSelector} into
 * (cell, pass) units, each unit is read on the {@link ConcurrencyScheduler}, and once all
 * units of a run are in, a follow-up task on the same scheduler matches the run's
 * candidates and tries to compute a solution. No task ever waits on another task, so
 * the pool cannot starve itself.
 *
 * <p>The first run to produce a validated solution wins and raises the solve's
 * cancellation signal so the remaining units stop early. When several runs succeed
 * concurrently, which one wins depends on thread timing and is not deterministic;
 * any of them is a valid solution of the same field.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlateSolver {

    static final int MIN_AUTO_STARS = 300;
    static final int MAX_AUTO_STARS = 1000;
    static final double AUTO_STARS_FRACTION = 0.33;
    static final int MAX_RECOMMENDED_STARS = 1200;
    static final double SIZE_BOOST = 50.0;
    static final int REFINEMENT_DENSITY_OFFSET = 5;

    private final SearchRegionSelector regionSelector;
    private final QuadMatcher quadMatcher;
    private final SolutionCalculator solutionCalculator;
    private final ConcurrencyScheduler scheduler;
    private final SolverProperties properties;

    /**
     * Solves the field.
     *
     * @return {@link SolveStatus#SOLVED} with a solution, or the reason there is none;
     *         never a partial or unvalidated solution
     * @throws SolverInputException if the stars contain non-finite positions
     */
    public SolveResult solve(final List<ImageStar> stars, final ImageMetadata image, final SearchParameters parameters) {
        final var started = System.nanoTime();
        for (final var star : stars) {
            if (!Double.isFinite(star.x()) || !Double.isFinite(star.y())) {
                throw new SolverInputException("Star position must be finite: " + star);
            }
        }
        if (stars.isEmpty()) {
            log.info("No stars to solve with");
            return SolveResult.unsolved(SolveStatus.NO_SOLUTION, SolveStats.empty(0, elapsedMillis(started)));
        }

        final var maxStars = resolveMaxStars(stars.size(), parameters);
        final var chosen = takeBrightest(stars, maxStars);
        final var quadSet = ImageQuadSet.form(chosen);
        log.info("Solving {}x{} image — {} stars detected, {} used, {} quads formed",
                image.width(), image.height(), stars.size(), chosen.size(), quadSet.quads().size());
        if (quadSet.quads().isEmpty()) {
            return SolveResult.unsolved(SolveStatus.NO_SOLUTION,
                    new SolveStats(stars.size(), chosen.size(), 0, 0, 0, 0, 0, elapsedMillis(started)));
        }

        final var session = new SolveSession(image, quadSet, parameters, stars.size(), chosen.size(), started);
        final var result = session.run();
        log.info("Solve finished — status={}, runs={}, units={}, elapsed={} ms",
                result.status(), result.stats().runsSearched(), result.stats().unitsScanned(),
                result.stats().elapsedMillis());
        return result;
    }

    int resolveMaxStars(final int detected, final SearchParameters parameters) {
        if (parameters.maxStars().isPresent() || properties.maxStars() > 0) {
            final var requested = parameters.maxStars().orElse(properties.maxStars());
            if (requested > MAX_RECOMMENDED_STARS) {
                log.warn("maxStars={} is above the recommended {}, solving may be slow", requested, MAX_RECOMMENDED_STARS);
            }
            return requested;
        }
        final var share = AUTO_STARS_FRACTION * detected;
        return share <= MIN_AUTO_STARS ? MIN_AUTO_STARS : (int) FastMath.min(share, MAX_AUTO_STARS);
    }

    /**
     * Brightest stars first. Stars larger than the median size get a brightness bonus
     * proportional to their size, since saturated stars under-report their flux.
     */
    static List<ImageStar> takeBrightest(final List<ImageStar> stars, final int count) {
        final var sizes = stars.stream().mapToDouble(ImageStar::size).sorted().toArray();
        final var medianSize = QuadMatcher.median(sizes);
        final Comparator<ImageStar> byScore = Comparator.comparingDouble(star ->
                medianSize > 0.0 && star.size() > medianSize
                        ? star.brightness() + star.size() / medianSize * SIZE_BOOST
                        : star.brightness());
        return stars.stream()
                .sorted(byScore.reversed())
                .limit(count)
                .toList();
    }

    private static long elapsedMillis(final long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static Throwable unwrap(final Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    /**
     * State of one {@link #solve} call. Created per call and dropped with it.
     */
    private final class SolveSession {

        private final ImageMetadata image;
        private final ImageQuadSet quadSet;
        private final QuadMatcher.ImageQuadIndex quadIndex;
        private final SearchParameters parameters;
        private final CancellationSignal signal;
        private final long started;
        private final long deadline;
        private final int starsDetected;
        private final int starsUsed;

        private final AtomicReference<Solution> winner = new AtomicReference<>();
        private final AtomicInteger runsSearched = new AtomicInteger();
        private final AtomicInteger unitsScanned = new AtomicInteger();
        private final AtomicLong candidateQuads = new AtomicLong();

        SolveSession(final ImageMetadata image, final ImageQuadSet quadSet, final SearchParameters parameters,
                     final int starsDetected, final int starsUsed, final long started) {
            this.image = image;
            this.quadSet = quadSet;
            this.quadIndex = quadMatcher.index(quadSet.quads());
            this.parameters = parameters;
            this.signal = parameters.cancellation().child();
            this.started = started;
            this.deadline = started + parameters.timeout().orElse(properties.timeout()).toNanos();
            this.starsDetected = starsDetected;
            this.starsUsed = starsUsed;
        }

        SolveResult run() {
            final var strategy = parameters.strategy();
            final var runs = strategy.searchRuns();
            final var batchSize = strategy.useParallelism() ? FastMath.max(1, properties.runBatchSize()) : 1;

            for (var from = 0; from < runs.size(); from += batchSize) {
                if (parameters.cancellation().isCancelled()) {
                    return finish(SolveStatus.CANCELLED);
                }
                final var batch = runs.subList(from, FastMath.min(runs.size(), from + batchSize));
                final var futures = batch.stream().map(this::searchRun).toList();
                try {
                    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                            .get(FastMath.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (final TimeoutException e) {
                    signal.cancel();
                    log.warn("Solve deadline of {} passed after {} runs", parameters.timeout().orElse(properties.timeout()),
                            runsSearched.get());
                    return finish(winner.get() != null ? SolveStatus.SOLVED : SolveStatus.TIMEOUT);
                } catch (final InterruptedException e) {
                    signal.cancel();
                    Thread.currentThread().interrupt();
                    return finish(SolveStatus.CANCELLED);
                } catch (final ExecutionException e) {
                    // runs recover their own failures; reaching this is a bug in the run pipeline
                    log.error("Search run batch failed: {}", e.getCause().getMessage(), e.getCause());
                }
                if (winner.get() != null) {
                    return finish(SolveStatus.SOLVED);
                }
            }
            if (parameters.cancellation().isCancelled()) {
                return finish(SolveStatus.CANCELLED);
            }
            return finish(SolveStatus.NO_SOLUTION);
        }

        private SolveResult finish(final SolveStatus status) {
            signal.cancel();
            final var solution = status == SolveStatus.SOLVED ? winner.get() : null;
            final var stats = new SolveStats(starsDetected, starsUsed, quadSet.quads().size(), runsSearched.get(),
                    unitsScanned.get(), candidateQuads.get(), solution != null ? solution.matchedQuads() : 0,
                    elapsedMillis(started));
            return new SolveResult(status, solution, stats);
        }

        /**
         * Scans every unit of the run concurrently, then matches the pooled candidates in one more task.
         */
        private CompletableFuture<Optional<Solution>> searchRun(final SearchRun run) {
            if (signal.isCancelled()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            final var units = regionSelector.selectUnits(run.center(), run.radius(), quadDensity(run), run.offsets());
            if (units.isEmpty()) {
                runsSearched.incrementAndGet();
                return CompletableFuture.completedFuture(Optional.empty());
            }

            final var unitFutures = units.stream()
                    .map(unit -> scheduler.submit(signal, s -> scanUnit(unit, s))
                            .exceptionally(t -> recoverUnit(unit, t)))
                    .toList();

            return CompletableFuture.allOf(unitFutures.toArray(CompletableFuture[]::new))
                    .thenCompose(ignored -> {
                        runsSearched.incrementAndGet();
                        final var candidates = new LinkedHashSet<QuadRecord>();
                        unitFutures.forEach(f -> candidates.addAll(f.join()));
                        return scheduler.submit(signal, s -> matchRun(run, List.copyOf(candidates), s));
                    })
                    .exceptionally(t -> {
                        final var cause = unwrap(t);
                        if (!(cause instanceof CancelledException)) {
                            log.warn("Matching for run {} failed: {}", run, cause.getMessage());
                        }
                        return Optional.empty();
                    });
        }

        private List<QuadRecord> scanUnit(final SearchUnit unit, final CancellationSignal s) {
            unitsScanned.incrementAndGet();
            try (var quads = unit.pass().stream()) {
                final var found = quadMatcher.candidates(
                        quads.takeWhile(q -> !s.isCancelled()), quadIndex, unit.center(), unit.radius());
                candidateQuads.addAndGet(found.size());
                return found;
            }
        }

        private List<QuadRecord> recoverUnit(final SearchUnit unit, final Throwable t) {
            final var cause = unwrap(t);
            if (cause instanceof CancelledException) {
                log.debug("Unit {} skipped, solve cancelled", unit);
            } else {
                log.warn("Unit {} failed, continuing without it: {}", unit, cause.getMessage());
            }
            return List.of();
        }

        private Optional<Solution> matchRun(final SearchRun run, final List<QuadRecord> candidates,
                                            final CancellationSignal s) {
            final var minMatches = properties.minMatches();
            if (s.isCancelled() || candidates.size() < minMatches) {
                return Optional.empty();
            }
            final var pixelToAngleRatio = image.diagonal() / (2.0 * run.radius());
            final var matches = quadMatcher.findMatches(pixelToAngleRatio, quadSet.quads(), candidates, minMatches);
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            log.debug("Run {}: {} candidates, {} consistent matches", run, candidates.size(), matches.size());

            final var preliminary = tryCalculate(matches, run.center());
            if (preliminary.isEmpty()) {
                return Optional.empty();
            }
            if (preliminary.get().fieldRadius() > 2.0 * run.radius()) {
                log.debug("Run {}: rejected, field radius {} too large", run, preliminary.get().fieldRadius());
                return Optional.empty();
            }

            final var refined = refine(preliminary.get(), s);
            if (refined.isEmpty()) {
                log.debug("Run {}: refinement failed", run);
                return Optional.empty();
            }
            if (winner.compareAndSet(null, refined.get())) {
                log.info("Solution found in run {} — center={}, orientation={}, scale={}\"/px",
                        run, refined.get().plateCenter(),
                        String.format("%.2f", refined.get().orientation()),
                        String.format("%.3f", refined.get().pixelScale()));
                signal.cancel();
            }
            return refined;
        }

        /**
         * Repeats the match around the preliminary center with the preliminary field radius and a
         * wide density window. Runs inside the calling worker, reading units one after another.
         */
        private Optional<Solution> refine(final Solution preliminary, final CancellationSignal s) {
            final var center = preliminary.plateCenter();
            final var radius = preliminary.fieldRadius();
            final var units = regionSelector.selectUnits(center, radius,
                    quadSet.countInFirstPass() / searchArea(radius),
                    DensityOffsets.symmetric(REFINEMENT_DENSITY_OFFSET));

            final var candidates = new LinkedHashSet<QuadRecord>();
            for (final var unit : units) {
                if (s.isCancelled()) {
                    return Optional.empty();
                }
                try {
                    candidates.addAll(scanUnit(unit, s));
                } catch (final RuntimeException e) {
                    recoverUnit(unit, e);
                }
            }
            final var matches = quadMatcher.findMatches(image.diagonal() / (2.0 * radius),
                    quadSet.quads(), candidates, properties.minMatches());
            return matches.isEmpty() ? Optional.empty() : tryCalculate(matches, center);
        }

        private Optional<Solution> tryCalculate(final List<QuadMatch> matches,
                                                final EquatorialCoords projectionCenter) {
            try {
                final var solution = solutionCalculator.calculate(image, matches, projectionCenter);
                return solutionCalculator.isValid(solution) ? Optional.of(solution) : Optional.empty();
            } catch (final DegenerateSystemException e) {
                log.debug("Degenerate match set of {} pairs: {}", matches.size(), e.getMessage());
                return Optional.empty();
            }
        }

        private double quadDensity(final SearchRun run) {
            return quadSet.countInFirstPass() / searchArea(run.radius());
        }

        /** Area of the image-shaped rectangle inscribed in a circle of the given radius. */
        private double searchArea(final double radius) {
            final var size = 2.0 * radius;
            final var angle = FastMath.atan((double) image.height() / image.width());
            return (size * FastMath.sin(angle)) * (size * FastMath.cos(angle));
        }
    }
}
