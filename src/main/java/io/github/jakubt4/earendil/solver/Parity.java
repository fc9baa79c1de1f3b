package io.github.jakubt4.earendil.solver;

/**
 * Handedness of the image relative to the sky. {@code NORMAL} is the view through a
 * telescope without a mirror: north up puts east to the left.
 */
public enum Parity {
    NORMAL,
    FLIPPED
}
