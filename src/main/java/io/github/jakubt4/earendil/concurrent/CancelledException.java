package io.github.jakubt4.earendil.concurrent;

/**
 * Completes the future of a queued unit whose {@link CancellationSignal} was raised before it could start.
 */
public class CancelledException extends RuntimeException {

    public CancelledException() {
        super("Cancelled", null, false, false);
    }
}
