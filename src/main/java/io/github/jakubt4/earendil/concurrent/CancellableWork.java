package io.github.jakubt4.earendil.concurrent;

/**
 * A unit of work that polls the given signal between increments.
 */
@FunctionalInterface
public interface CancellableWork<T> {

    T run(CancellationSignal signal) throws Exception;
}
