package io.github.jakubt4.earendil.solver;

/**
 * One observation {@code a1*x1 + a2*x2 + a3*x3 = b} of an over-determined linear system.
 */
public record EquationOfCondition(double a1, double a2, double a3, double b) {
}
