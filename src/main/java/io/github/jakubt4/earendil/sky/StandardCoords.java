package io.github.jakubt4.earendil.sky;

/**
 * Tangent-plane coordinates in degrees, relative to a projection center.
 */
public record StandardCoords(double xi, double eta) {
}
