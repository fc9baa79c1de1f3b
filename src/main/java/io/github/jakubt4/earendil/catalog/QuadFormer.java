package io.github.jakubt4.earendil.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleBiFunction;

/**
 * Builds scale and rotation invariant quads from a star list. Used identically for
 * image stars (pixel distances) and catalog stars (angular distances), which is what
 * makes the two sides comparable.
 *
 * <p>Every star forms one quad with its three nearest neighbours. Of the six pairwise
 * distances of the four stars the largest becomes the quad's scale; the remaining
 * five divided by it, in ascending order, are the quad's ratios. Stars at zero
 * distance from each other are never treated as neighbours.
 */
public final class QuadFormer {

    /**
     * @param starIndices     indices into the input list, ascending; identifies the star set
     * @param ratios          five ascending ratios in {@code (0, 1]}
     * @param largestDistance scale of the quad, in the units of the distance function
     */
    public record FormedQuad(int[] starIndices, float[] ratios, double largestDistance) {

        public StarSetKey key() {
            return new StarSetKey(starIndices[0], starIndices[1], starIndices[2], starIndices[3]);
        }
    }

    /** Identity of a quad's star set, independent of the order the stars were picked in. */
    public record StarSetKey(int first, int second, int third, int fourth) {
    }

    private QuadFormer() {
    }

    /**
     * Forms one quad per star that has at least three neighbours at non-zero distance.
     * The result may contain several quads over the same star set; callers de-duplicate by {@link FormedQuad#key()}.
     *
     * @return empty if fewer than four stars are given
     */
    public static <T> List<FormedQuad> form(final List<T> stars, final ToDoubleBiFunction<T, T> distance) {
        final var n = stars.size();
        if (n < 4) {
            return List.of();
        }

        final var quads = new ArrayList<FormedQuad>(n);
        final var nearest = new int[3];
        final var nearestDistances = new double[3];
        for (var i = 0; i < n; i++) {
            final var origin = stars.get(i);
            Arrays.fill(nearest, -1);
            Arrays.fill(nearestDistances, Double.MAX_VALUE);

            for (var j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                final var d = distance.applyAsDouble(origin, stars.get(j));
                if (!(d > 0.0) || d >= nearestDistances[2]) {
                    continue;
                }
                // insertion into the sorted top-3
                var slot = 2;
                while (slot > 0 && d < nearestDistances[slot - 1]) {
                    nearestDistances[slot] = nearestDistances[slot - 1];
                    nearest[slot] = nearest[slot - 1];
                    slot--;
                }
                nearestDistances[slot] = d;
                nearest[slot] = j;
            }
            if (nearest[2] < 0) {
                continue;
            }

            final var a = stars.get(nearest[0]);
            final var b = stars.get(nearest[1]);
            final var c = stars.get(nearest[2]);
            final var distances = new double[]{
                    nearestDistances[0], nearestDistances[1], nearestDistances[2],
                    distance.applyAsDouble(a, b), distance.applyAsDouble(a, c), distance.applyAsDouble(b, c)
            };
            Arrays.sort(distances);
            final var largest = distances[5];
            final var ratios = new float[5];
            for (var k = 0; k < 5; k++) {
                ratios[k] = (float) (distances[k] / largest);
            }

            final var indices = new int[]{i, nearest[0], nearest[1], nearest[2]};
            Arrays.sort(indices);
            quads.add(new FormedQuad(indices, ratios, largest));
        }
        return quads;
    }
}
