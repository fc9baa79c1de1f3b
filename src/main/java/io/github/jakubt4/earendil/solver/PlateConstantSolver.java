package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.exception.DegenerateSystemException;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Closed-form least-squares solver for three unknowns.
 *
 * <p>Accumulates the symmetric 3x3 normal-equation system in one pass over the
 * equations and solves it with Cramer's rule. A system whose determinant is
 * negligible relative to the product of its diagonal is rejected as degenerate
 * instead of producing huge or NaN coefficients.
 */
@Component
public class PlateConstantSolver {

    static final double DEGENERACY_TOLERANCE = 1e-12;

    /**
     * @throws DegenerateSystemException for fewer than three equations or a (near) singular system
     */
    public LeastSquaresSolution solve(final List<EquationOfCondition> equations) {
        if (equations.size() < 3) {
            throw new DegenerateSystemException("At least 3 equations are needed, got " + equations.size());
        }

        double a11 = 0, a12 = 0, a13 = 0, a22 = 0, a23 = 0, a33 = 0;
        double b1 = 0, b2 = 0, b3 = 0;
        for (final var eq : equations) {
            a11 += eq.a1() * eq.a1();
            a12 += eq.a1() * eq.a2();
            a13 += eq.a1() * eq.a3();
            a22 += eq.a2() * eq.a2();
            a23 += eq.a2() * eq.a3();
            a33 += eq.a3() * eq.a3();
            b1 += eq.a1() * eq.b();
            b2 += eq.a2() * eq.b();
            b3 += eq.a3() * eq.b();
        }

        final var det = det3(a11, a12, a13, a12, a22, a23, a13, a23, a33);
        final var scale = a11 * a22 * a33;
        if (!Double.isFinite(det) || !(FastMath.abs(det) > DEGENERACY_TOLERANCE * scale)) {
            throw new DegenerateSystemException("Normal equations are singular (det=" + det + ", scale=" + scale + ")");
        }

        return new LeastSquaresSolution(
                det3(b1, a12, a13, b2, a22, a23, b3, a23, a33) / det,
                det3(a11, b1, a13, a12, b2, a23, a13, b3, a33) / det,
                det3(a11, a12, b1, a12, a22, b2, a13, a23, b3) / det);
    }

    /**
     * Fits {@link PlateConstants} to matched positions with one least-squares solve per axis.
     *
     * @throws DegenerateSystemException if the pixel positions are collinear or fewer than three
     */
    public PlateConstants solvePlateConstants(final List<Correspondence> correspondences) {
        final var xi = solve(correspondences.stream()
                .map(c -> new EquationOfCondition(c.x(), c.y(), 1.0, c.standard().xi()))
                .toList());
        final var eta = solve(correspondences.stream()
                .map(c -> new EquationOfCondition(c.x(), c.y(), 1.0, c.standard().eta()))
                .toList());
        return new PlateConstants(xi.x1(), xi.x2(), xi.x3(), eta.x1(), eta.x2(), eta.x3());
    }

    // Row-major 3x3 determinant.
    private static double det3(final double m11, final double m12, final double m13,
                               final double m21, final double m22, final double m23,
                               final double m31, final double m32, final double m33) {
        return m11 * (m22 * m33 - m23 * m32)
                - m12 * (m21 * m33 - m23 * m31)
                + m13 * (m21 * m32 - m22 * m31);
    }
}
