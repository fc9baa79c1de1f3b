package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.exception.SolverInputException;

/**
 * Dimensions of the image the stars were detected in.
 */
public record ImageMetadata(int width, int height) {

    public ImageMetadata {
        if (width <= 0 || height <= 0) {
            throw new SolverInputException("Image dimensions must be positive, were " + width + "x" + height);
        }
    }

    public double diagonal() {
        return Math.sqrt((double) width * width + (double) height * height);
    }
}
