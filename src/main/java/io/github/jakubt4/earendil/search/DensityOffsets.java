package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.exception.SolverInputException;

import java.util.OptionalInt;

/**
 * How many passes below and above the best-matching density pass to scan.
 *
 * <p>Image density estimates are imperfect, so by default one neighbouring
 * pass on each side is included.
 */
public record DensityOffsets(int lower, int higher) {

    public static final int DEFAULT_OFFSET = 1;
    public static final int MAX_RECOMMENDED_OFFSET = 3;
    public static final DensityOffsets DEFAULT = new DensityOffsets(DEFAULT_OFFSET, DEFAULT_OFFSET);

    public DensityOffsets {
        if (lower < 0 || higher < 0) {
            throw new SolverInputException("Density offsets must be non-negative, were " + lower + "/" + higher);
        }
    }

    /** Fills in {@link #DEFAULT_OFFSET} for whichever side is not given. */
    public static DensityOffsets of(final OptionalInt lower, final OptionalInt higher) {
        return new DensityOffsets(lower.orElse(DEFAULT_OFFSET), higher.orElse(DEFAULT_OFFSET));
    }

    /** Symmetric offsets, used by the refinement pass. */
    public static DensityOffsets symmetric(final int offset) {
        return new DensityOffsets(offset, offset);
    }
}
