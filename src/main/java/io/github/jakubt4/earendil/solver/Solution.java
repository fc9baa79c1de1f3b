package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.dto.WcsHeaderRecord;
import io.github.jakubt4.earendil.sky.EquatorialCoords;

import java.util.List;

/**
 * A validated plate solution.
 *
 * @param plateCenter      sky position of the image center
 * @param projectionCenter tangent point the plate constants are expressed around
 * @param fieldRadius      half the image diagonal, degrees
 * @param fieldWidth       image width, degrees
 * @param fieldHeight      image height, degrees
 * @param orientation      position angle of image "up", degrees east of north, {@code (-180, 180]}
 * @param pixelScale       arcseconds per pixel
 * @param parity           image handedness
 * @param imageWidth       pixels
 * @param imageHeight      pixels
 * @param plateConstants   pixel to standard coordinate map around {@code projectionCenter}
 * @param wcs              the equivalent TAN WCS terms
 * @param matchedQuads     number of quad pairs the solution was computed from
 */
public record Solution(
        EquatorialCoords plateCenter,
        EquatorialCoords projectionCenter,
        double fieldRadius,
        double fieldWidth,
        double fieldHeight,
        double orientation,
        double pixelScale,
        Parity parity,
        int imageWidth,
        int imageHeight,
        PlateConstants plateConstants,
        WcsCoefficients wcs,
        int matchedQuads) {

    /** Sky position of an arbitrary pixel. */
    public EquatorialCoords pixelToEquatorial(final double x, final double y) {
        final var standard = plateConstants.toStandard(x, y);
        return EquatorialCoords.fromStandard(projectionCenter, standard.xi(), standard.eta());
    }

    /**
     * WCS keywords describing this solution, in the order a FITS header would list them.
     */
    public List<WcsHeaderRecord> wcsHeaderRecords() {
        return List.of(
                WcsHeaderRecord.of("WCSAXES", 2L, "ra and dec"),
                WcsHeaderRecord.of("CTYPE1", "RA---TAN", "gnomonic projection"),
                WcsHeaderRecord.of("CTYPE2", "DEC--TAN", "gnomonic projection"),
                WcsHeaderRecord.of("EQUINOX", 2000.0, "equatorial coordinates definition year"),
                WcsHeaderRecord.of("LONPOLE", 180.0, "native longitude of celestial pole"),
                WcsHeaderRecord.of("LATPOLE", 0.0, "native latitude of celestial pole"),
                WcsHeaderRecord.of("CRVAL1", wcs.crval1(), "RA of reference pixel"),
                WcsHeaderRecord.of("CRVAL2", wcs.crval2(), "DEC of reference pixel"),
                WcsHeaderRecord.of("CRPIX1", wcs.crpix1(), "X of reference pixel"),
                WcsHeaderRecord.of("CRPIX2", wcs.crpix2(), "Y of reference pixel"),
                WcsHeaderRecord.of("CUNIT1", "deg", "degrees"),
                WcsHeaderRecord.of("CUNIT2", "deg", "degrees"),
                WcsHeaderRecord.of("CD1_1", wcs.cd11(), "cd matrix"),
                WcsHeaderRecord.of("CD1_2", wcs.cd12(), "cd matrix"),
                WcsHeaderRecord.of("CD2_1", wcs.cd21(), "cd matrix"),
                WcsHeaderRecord.of("CD2_2", wcs.cd22(), "cd matrix"),
                WcsHeaderRecord.of("IMAGEW", (long) imageWidth, "image width in pixels"),
                WcsHeaderRecord.of("IMAGEH", (long) imageHeight, "image height in pixels"),
                WcsHeaderRecord.comment("plate solved from " + matchedQuads + " quad matches"));
    }
}
