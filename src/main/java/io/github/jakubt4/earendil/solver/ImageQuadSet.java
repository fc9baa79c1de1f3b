package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.catalog.QuadFormer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * The quads of one image and the quad count used to estimate the image's quad density.
 *
 * @param quads            distinct quads from all formation passes
 * @param countInFirstPass distinct quads formed from the full star list
 */
public record ImageQuadSet(List<ImageQuad> quads, int countInFirstPass) {

    static final int FORMATION_PASSES = 4;
    static final double PASS_REDUCTION = 0.05;

    /**
     * Forms quads over the brightest 100%, 95%, 90% and 85% of the stars. Dropping the
     * faintest stars changes some nearest-neighbour sets, which adds alternative quads
     * for the same region and makes matching more robust against missing detections.
     *
     * @param starsBrightestFirst stars ordered by descending brightness
     */
    public static ImageQuadSet form(final List<ImageStar> starsBrightestFirst) {
        final var seen = new HashSet<QuadFormer.StarSetKey>();
        final var quads = new ArrayList<ImageQuad>();
        var countInFirstPass = 0;

        for (var pass = 0; pass < FORMATION_PASSES; pass++) {
            final var count = (int) (starsBrightestFirst.size() * (1.0 - pass * PASS_REDUCTION));
            final var stars = starsBrightestFirst.subList(0, count);
            for (final var formed : QuadFormer.form(stars, ImageStar::distanceTo)) {
                if (!seen.add(formed.key())) {
                    continue;
                }
                var midX = 0.0;
                var midY = 0.0;
                for (final var index : formed.starIndices()) {
                    midX += stars.get(index).x();
                    midY += stars.get(index).y();
                }
                quads.add(new ImageQuad(formed.ratios(), (float) formed.largestDistance(), midX / 4.0, midY / 4.0));
            }
            if (pass == 0) {
                countInFirstPass = quads.size();
            }
        }
        return new ImageQuadSet(List.copyOf(quads), countInFirstPass);
    }
}
