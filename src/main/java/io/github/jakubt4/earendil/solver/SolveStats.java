package io.github.jakubt4.earendil.solver;

/**
 * Counters collected during a solve, for logging and diagnostics.
 *
 * @param starsDetected  stars handed to the solver
 * @param starsUsed      brightest stars kept for quad formation
 * @param imageQuads     distinct quads formed from the image
 * @param runsSearched   search runs whose units were all scanned
 * @param unitsScanned   (cell, pass) units read
 * @param candidateQuads catalog quads that passed the loose shape filter
 * @param matchedQuads   quad pairs behind the returned solution, 0 if none
 * @param elapsedMillis  wall-clock duration of the solve
 */
public record SolveStats(int starsDetected, int starsUsed, int imageQuads, int runsSearched,
                         int unitsScanned, long candidateQuads, int matchedQuads, long elapsedMillis) {

    public static SolveStats empty(final int starsDetected, final long elapsedMillis) {
        return new SolveStats(starsDetected, 0, 0, 0, 0, 0, 0, elapsedMillis);
    }
}
