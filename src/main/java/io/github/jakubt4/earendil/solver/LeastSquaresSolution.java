package io.github.jakubt4.earendil.solver;

public record LeastSquaresSolution(double x1, double x2, double x3) {
}
