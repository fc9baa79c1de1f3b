package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.exception.DegenerateSystemException;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import lombok.RequiredArgsConstructor;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a set of consistent quad matches into a {@link Solution}.
 *
 * <p>The quad midpoints are the correspondences: pixel midpoint of the image quad against
 * the standard coordinates of the catalog quad's midpoint around the projection center.
 * Scale comes from the mean ratio of pixel to angular distances between all midpoint pairs.
 */
@Component
@RequiredArgsConstructor
public class SolutionCalculator {

    private final PlateConstantSolver plateConstantSolver;

    /**
     * @throws DegenerateSystemException if the matched midpoints do not constrain an affine transform
     */
    public Solution calculate(final ImageMetadata image, final List<QuadMatch> matches,
                              final EquatorialCoords projectionCenter) {
        final var correspondences = matches.stream()
                .map(m -> new Correspondence(m.imageQuad().midX(), m.imageQuad().midY(),
                        m.catalogQuad().midpoint().toStandard(projectionCenter)))
                .toList();
        final var pc = plateConstantSolver.solvePlateConstants(correspondences);
        if (!pc.isFinite()) {
            throw new DegenerateSystemException("Plate constants are not finite: " + pc);
        }

        final var pixelsPerDegree = pixelsPerDegree(matches);
        final var fieldRadius = 0.5 * image.diagonal() / pixelsPerDegree;
        final var pixelScale = 3600.0 * fieldRadius / (0.5 * image.diagonal());

        final var centerX = image.width() / 2.0;
        final var centerY = image.height() / 2.0;
        final var centerStandard = pc.toStandard(centerX, centerY);
        final var plateCenter = EquatorialCoords.fromStandard(
                projectionCenter, centerStandard.xi(), centerStandard.eta());

        // CD terms: in a TAN projection the intermediate world coordinates are the standard coordinates
        final var cd11 = pc.a();
        final var cd12 = pc.b();
        final var cd21 = pc.d();
        final var cd22 = pc.e();

        final var sign = cd11 * cd22 - cd12 * cd21 < 0 ? -1.0 : 1.0;
        final var crota1 = FastMath.toDegrees(FastMath.atan2(sign * cd12, cd22));
        final var crota2 = -FastMath.toDegrees(FastMath.atan2(cd21, sign * cd11));
        final var cdelt1 = sign * FastMath.sqrt(cd11 * cd11 + cd21 * cd21);
        final var cdelt2 = FastMath.sqrt(cd12 * cd12 + cd22 * cd22);
        final var parity = sign < 0 ? Parity.NORMAL : Parity.FLIPPED;

        final var referencePixel = pc.referencePixel();
        final var wcs = new WcsCoefficients(
                projectionCenter.ra(), projectionCenter.dec(),
                referencePixel[0], referencePixel[1],
                cd11, cd12, cd21, cd22,
                cdelt1, cdelt2, crota1, crota2);

        return new Solution(plateCenter, projectionCenter, fieldRadius,
                image.width() / pixelsPerDegree, image.height() / pixelsPerDegree,
                crota1, pixelScale, parity, image.width(), image.height(), pc, wcs, matches.size());
    }

    /** Whether the solution is numerically usable; NaNs creep in from near-degenerate fits. */
    public boolean isValid(final Solution solution) {
        return solution != null
                && solution.plateConstants().isFinite()
                && Double.isFinite(solution.orientation())
                && Double.isFinite(solution.fieldRadius())
                && solution.fieldRadius() > 0.0;
    }

    static double pixelsPerDegree(final List<QuadMatch> matches) {
        var sum = 0.0;
        var count = 0;
        for (var i = 0; i < matches.size(); i++) {
            for (var j = i + 1; j < matches.size(); j++) {
                final var pixelDistance = matches.get(i).imageQuad().pixelDistanceTo(matches.get(j).imageQuad());
                final var angularDistance = matches.get(i).catalogQuad().midpoint()
                        .angularDistanceTo(matches.get(j).catalogQuad().midpoint());
                if (pixelDistance > 0.0 && angularDistance > 0.0) {
                    sum += pixelDistance / angularDistance;
                    count++;
                }
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
