package io.github.jakubt4.earendil.sky;

import io.github.jakubt4.earendil.exception.SolverInputException;

/**
 * A rectangle on the sphere bounded by two meridians and two parallels.
 *
 * <p>When {@code raLeft > raRight} the range wraps across the 0/360 seam,
 * e.g. {@code (350, 10)} covers 350..360 and 0..10.
 */
public record RaDecBounds(double raLeft, double raRight, double decTop, double decBottom) {

    public RaDecBounds {
        if (decBottom > decTop || decBottom < -90.0 || decTop > 90.0) {
            throw new SolverInputException("Invalid Dec range [" + decBottom + ", " + decTop + "]");
        }
        if (raLeft < 0.0 || raLeft >= 360.0 || raRight <= 0.0 || raRight > 360.0) {
            throw new SolverInputException("Invalid RA range [" + raLeft + ", " + raRight + "]");
        }
    }

    public boolean wrapsRa() {
        return raLeft > raRight;
    }

    /** RA extent in degrees. */
    public double raWidth() {
        return wrapsRa() ? 360.0 - raLeft + raRight : raRight - raLeft;
    }

    public double decHeight() {
        return decTop - decBottom;
    }

    /** Half-open RA membership: left edge inclusive, right edge exclusive. */
    public boolean containsRa(final double ra) {
        return wrapsRa()
                ? ra >= raLeft || ra < raRight
                : ra >= raLeft && ra < raRight;
    }

    /** Open RA membership, both edges excluded. */
    public boolean strictlyContainsRa(final double ra) {
        return wrapsRa()
                ? ra > raLeft || ra < raRight
                : ra > raLeft && ra < raRight;
    }

    public EquatorialCoords center() {
        return EquatorialCoords.normalized(raLeft + raWidth() / 2.0, (decTop + decBottom) / 2.0);
    }
}
