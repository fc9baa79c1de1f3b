package io.github.jakubt4.earendil.solver;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of {@link PlateSolver#solve}.
 *
 * @param status   how the solve ended
 * @param solution the solution, present only when {@code status == SOLVED}
 * @param stats    diagnostics
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResult(SolveStatus status, Solution solution, SolveStats stats) {

    public SolveResult {
        if ((status == SolveStatus.SOLVED) != (solution != null)) {
            throw new IllegalArgumentException("A solution must be present exactly when status is SOLVED");
        }
    }

    public static SolveResult unsolved(final SolveStatus status, final SolveStats stats) {
        return new SolveResult(status, null, stats);
    }

    @JsonIgnore
    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }
}
