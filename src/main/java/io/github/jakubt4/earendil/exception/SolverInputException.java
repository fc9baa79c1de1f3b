package io.github.jakubt4.earendil.exception;

/**
 * Raised when a caller hands the solver malformed input: coordinates outside
 * their valid range, non-positive radii or image dimensions, or an unknown cell id.
 *
 * <p>Distinct from an unsuccessful solve, which is reported as a normal
 * {@link io.github.jakubt4.earendil.solver.SolveResult}.
 */
public class SolverInputException extends RuntimeException {

    public SolverInputException(final String message) {
        super(message);
    }
}
