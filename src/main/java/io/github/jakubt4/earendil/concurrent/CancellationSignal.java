package io.github.jakubt4.earendil.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the units of one solve.
 *
 * <p>A child signal reports cancelled when either it or any ancestor is cancelled,
 * which lets a solve combine the caller's cancellation with its own
 * "solution found" and deadline signals. Cancelling a child never affects the parent.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationSignal parent;

    private CancellationSignal(final CancellationSignal parent) {
        this.parent = parent;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    /** A signal that is never cancelled by anyone but the holder. */
    public static CancellationSignal none() {
        return create();
    }

    public CancellationSignal child() {
        return new CancellationSignal(this);
    }

    /** @return {@code true} if this call flipped the flag */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
