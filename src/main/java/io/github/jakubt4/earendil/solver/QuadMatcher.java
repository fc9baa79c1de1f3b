package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.catalog.QuadRecord;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Compares image quads with catalog quads by shape.
 *
 * <p>Two quads have the same shape when each of their five ratios differs by at most a
 * relative tolerance. Both sides are kept sorted by their first ratio so each lookup
 * only inspects the narrow window of quads whose first ratio can possibly qualify.
 */
@Slf4j
@Component
public class QuadMatcher {

    /** Loose tolerance used while streaming catalog passes. */
    public static final double CANDIDATE_TOLERANCE = 0.015;
    /** Tight tolerance used for the final pairing. */
    public static final double MATCH_TOLERANCE = 0.011;

    static final double ACCEPTED_SCALE_DEVIATION = 0.01;
    static final int SCALE_BINS = 10;

    /**
     * Image quads prepared for repeated candidate lookups; immutable and shareable between workers.
     */
    public static final class ImageQuadIndex {

        private final List<ImageQuad> quads;
        private final float[] firstRatios;

        private ImageQuadIndex(final List<ImageQuad> source) {
            this.quads = source.stream()
                    .filter(q -> q.ratios()[0] > 0.0f)
                    .sorted(Comparator.comparingDouble(q -> q.ratios()[0]))
                    .toList();
            this.firstRatios = new float[quads.size()];
            for (var i = 0; i < quads.size(); i++) {
                firstRatios[i] = quads.get(i).ratios()[0];
            }
        }

        public int size() {
            return quads.size();
        }

        boolean anySimilar(final float[] catalogRatios, final double tolerance) {
            final var r0 = catalogRatios[0];
            if (!(r0 > 0.0f)) {
                return false;
            }
            for (var i = lowerBound(firstRatios, r0 * (1.0 - tolerance)); i < firstRatios.length; i++) {
                if (firstRatios[i] > r0 * (1.0 + tolerance)) {
                    return false;
                }
                if (similar(quads.get(i).ratios(), catalogRatios, tolerance)) {
                    return true;
                }
            }
            return false;
        }
    }

    public ImageQuadIndex index(final List<ImageQuad> imageQuads) {
        return new ImageQuadIndex(imageQuads);
    }

    /**
     * Keeps the catalog quads that lie within {@code radius} of {@code center} and resemble
     * at least one image quad within {@link #CANDIDATE_TOLERANCE}.
     */
    public List<QuadRecord> candidates(final Stream<QuadRecord> catalogQuads, final ImageQuadIndex index,
                                       final EquatorialCoords center, final double radius) {
        final var centerVector = center.toVector();
        final var radiusRad = FastMath.toRadians(radius);
        return catalogQuads
                .filter(q -> index.anySimilar(q.ratios(), CANDIDATE_TOLERANCE))
                .filter(q -> Vector3D.angle(centerVector, q.midpoint().toVector()) < radiusRad)
                .toList();
    }

    /**
     * Pairs image quads with catalog quads of the same shape and discards pairs whose scale is
     * inconsistent with the majority.
     *
     * <ol>
     *   <li>every image quad is paired with every not yet used catalog quad within {@link #MATCH_TOLERANCE};</li>
     *   <li>if the median absolute deviation of the pairs' scale ratios exceeds 1% of the expected
     *       pixels-per-degree, the pairs are random and the result is empty;</li>
     *   <li>a weighted mean scale is computed with each pair weighted by the population of its
     *       histogram bin, and only pairs within one standard deviation of it are kept.</li>
     * </ol>
     *
     * @param pixelToAngleRatio expected pixels per degree of the search circle
     * @return the consistent pairs, or empty if fewer than {@code minMatches} survive
     */
    public List<QuadMatch> findMatches(final double pixelToAngleRatio, final List<ImageQuad> imageQuads,
                                       final Collection<QuadRecord> catalogQuads, final int minMatches) {
        final var catalog = catalogQuads.stream()
                .filter(q -> q.ratios()[0] > 0.0f)
                .sorted(Comparator.comparingDouble(q -> q.ratios()[0]))
                .toList();
        final var catalogFirstRatios = new float[catalog.size()];
        for (var i = 0; i < catalog.size(); i++) {
            catalogFirstRatios[i] = catalog.get(i).ratios()[0];
        }
        final var used = new boolean[catalog.size()];

        final var matches = new ArrayList<QuadMatch>();
        for (final var imageQuad : imageQuads) {
            final var r0 = imageQuad.ratios()[0];
            if (!(r0 > 0.0f)) {
                continue;
            }
            final var high = r0 / (1.0 - MATCH_TOLERANCE);
            for (var i = lowerBound(catalogFirstRatios, r0 / (1.0 + MATCH_TOLERANCE)); i < catalog.size(); i++) {
                if (catalogFirstRatios[i] > high) {
                    break;
                }
                if (!used[i] && similar(imageQuad.ratios(), catalog.get(i).ratios(), MATCH_TOLERANCE)) {
                    used[i] = true;
                    matches.add(new QuadMatch(imageQuad, catalog.get(i)));
                }
            }
        }

        if (matches.size() < minMatches) {
            return List.of();
        }

        final var scales = matches.stream().mapToDouble(QuadMatch::scaleRatio).sorted().toArray();
        final var medianScale = median(scales);
        final var deviations = Arrays.stream(scales).map(s -> FastMath.abs(s - medianScale)).sorted().toArray();
        final var medianDeviation = median(deviations);
        if (medianDeviation > pixelToAngleRatio * ACCEPTED_SCALE_DEVIATION) {
            log.debug("Rejecting {} pairs, scale MAD {} over limit {}",
                    matches.size(), medianDeviation, pixelToAngleRatio * ACCEPTED_SCALE_DEVIATION);
            return List.of();
        }

        final var weightedMean = binnedWeightedMean(scales);
        var squares = 0.0;
        for (final var scale : scales) {
            squares += (scale - weightedMean) * (scale - weightedMean);
        }
        final var stdDev = FastMath.sqrt(squares / scales.length);

        final var consistent = matches.stream()
                .filter(m -> FastMath.abs(m.scaleRatio() - weightedMean) <= stdDev)
                .toList();
        return consistent.size() >= minMatches ? consistent : List.of();
    }

    static boolean similar(final float[] image, final float[] catalog, final double tolerance) {
        for (var k = 0; k < image.length; k++) {
            if (!(catalog[k] > 0.0f) || FastMath.abs(image[k] / catalog[k] - 1.0) > tolerance) {
                return false;
            }
        }
        return true;
    }

    static double median(final double[] sorted) {
        final var mid = sorted.length / 2;
        return sorted.length % 2 != 0 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Mean of sorted values, each weighted by how many values share its histogram bin. */
    static double binnedWeightedMean(final double[] sorted) {
        final var min = sorted[0];
        final var width = (sorted[sorted.length - 1] - min) / SCALE_BINS;
        final var bins = new int[SCALE_BINS];
        final var binOf = new int[sorted.length];
        for (var i = 0; i < sorted.length; i++) {
            final var bin = width > 0.0 ? FastMath.min(SCALE_BINS - 1, (int) ((sorted[i] - min) / width)) : 0;
            bins[bin]++;
            binOf[i] = bin;
        }
        var total = 0.0;
        var weights = 0.0;
        for (var i = 0; i < sorted.length; i++) {
            final var weight = bins[binOf[i]];
            total += weight * sorted[i];
            weights += weight;
        }
        return total / weights;
    }

    private static int lowerBound(final float[] sorted, final double value) {
        var low = 0;
        var high = sorted.length;
        while (low < high) {
            final var mid = (low + high) >>> 1;
            if (sorted[mid] < value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
