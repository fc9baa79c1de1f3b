package io.github.jakubt4.earendil.solver;

import io.github.jakubt4.earendil.concurrent.CancellationSignal;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.search.SearchStrategy;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Caller-controlled settings of a single solve. Unset optionals fall back to the
 * application configuration.
 *
 * @param strategy     where to look
 * @param timeout      solve deadline, measured from the call
 * @param maxStars     how many of the brightest stars to form quads from
 * @param cancellation signal the caller may raise to abort the solve
 */
public record SearchParameters(SearchStrategy strategy, Optional<Duration> timeout, OptionalInt maxStars,
                               CancellationSignal cancellation) {

    public SearchParameters {
        if (strategy == null) {
            throw new SolverInputException("A search strategy is required");
        }
        timeout.ifPresent(t -> {
            if (t.isNegative() || t.isZero()) {
                throw new SolverInputException("Timeout must be positive, was " + t);
            }
        });
        maxStars.ifPresent(n -> {
            if (n < 4) {
                throw new SolverInputException("At least 4 stars are needed to form a quad, maxStars was " + n);
            }
        });
    }

    public static SearchParameters of(final SearchStrategy strategy) {
        return new SearchParameters(strategy, Optional.empty(), OptionalInt.empty(), CancellationSignal.create());
    }

    public SearchParameters withTimeout(final Duration value) {
        return new SearchParameters(strategy, Optional.of(value), maxStars, cancellation);
    }

    public SearchParameters withMaxStars(final int value) {
        return new SearchParameters(strategy, timeout, OptionalInt.of(value), cancellation);
    }

    public SearchParameters withCancellation(final CancellationSignal value) {
        return new SearchParameters(strategy, timeout, maxStars, value);
    }
}
