package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.sky.StandardCoords;

/**
 * A pixel position matched to the standard coordinates of the same point on the sky.
 */
public record Correspondence(double x, double y, StandardCoords standard) {
}
