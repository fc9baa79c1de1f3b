package io.github.jakubt4.earendil.solver;

/**
 * Terminal outcome of a solve.
 */
public enum SolveStatus {
    /** A validated solution was found. */
    SOLVED,
    /** The configured search space was exhausted without a qualifying match. */
    NO_SOLUTION,
    /** The deadline passed before a solution was found. */
    TIMEOUT,
    /** The caller cancelled the solve. */
    CANCELLED
}
