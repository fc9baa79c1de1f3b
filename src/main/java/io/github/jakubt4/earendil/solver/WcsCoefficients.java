package io.github.jakubt4.earendil.solver;

/**
 * TAN projection WCS terms of a solution. Angles and CD elements in degrees,
 * reference pixel in image pixels.
 */
public record WcsCoefficients(
        double crval1, double crval2,
        double crpix1, double crpix2,
        double cd11, double cd12, double cd21, double cd22,
        double cdelt1, double cdelt2,
        double crota1, double crota2) {
}
