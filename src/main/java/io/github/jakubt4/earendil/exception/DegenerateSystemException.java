package io.github.jakubt4.earendil.exception;

/**
 * The normal-equation system of a least-squares fit is singular or too close to
 * singular to give a stable answer (collinear or too few correspondences).
 */
public class DegenerateSystemException extends RuntimeException {

    public DegenerateSystemException(final String message) {
        super(message);
    }
}
