package io.github.jakubt4.earendil.concurrent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded worker pool that runs independent units of work.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>at most {@link #limit()} units run at the same time;</li>
 *   <li>every accepted unit runs, queued units wait in an unbounded FIFO queue
 *       (order of execution among queued units is not part of the contract);</li>
 *   <li>a unit that throws only completes its own future exceptionally;</li>
 *   <li>cancellation is cooperative: the scheduler hands the signal to the unit and,
 *       if the signal is already raised when a queued unit is dequeued, completes the
 *       unit with {@link CancelledException} without running its body.</li>
 * </ul>
 *
 * <p>Units must not block on futures of other units of the same scheduler; compose
 * them with {@link CompletableFuture#thenCompose} instead, otherwise a saturated pool
 * can deadlock.
 */
@Slf4j
public class ConcurrencyScheduler implements AutoCloseable {

    private final int limit;
    private final ThreadPoolExecutor executor;
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakRunning = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();

    public ConcurrencyScheduler(final int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, was " + limit);
        }
        this.limit = limit;
        this.executor = new ThreadPoolExecutor(limit, limit, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("solver-worker-"));
        log.info("Concurrency scheduler started — limit={}", limit);
    }

    public static int defaultLimit() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Queues a cancellable unit.
     *
     * @return a future completed with the unit's result, or exceptionally with what it threw
     */
    public <T> CompletableFuture<T> submit(final CancellationSignal signal, final CancellableWork<T> work) {
        final var future = new CompletableFuture<T>();
        executor.execute(() -> {
            if (signal.isCancelled()) {
                future.completeExceptionally(new CancelledException());
                return;
            }
            final var now = running.incrementAndGet();
            peakRunning.accumulateAndGet(now, Math::max);
            try {
                future.complete(work.run(signal));
            } catch (final Throwable t) {
                future.completeExceptionally(t);
            } finally {
                running.decrementAndGet();
                completed.incrementAndGet();
            }
        });
        return future;
    }

    /** Queues a unit that does not take part in cancellation. */
    public <T> CompletableFuture<T> submit(final Callable<T> task) {
        return submit(CancellationSignal.none(), signal -> task.call());
    }

    public int limit() {
        return limit;
    }

    /** Units executing right now. */
    public int running() {
        return running.get();
    }

    /** Highest number of units observed executing at once since construction. */
    public int peakRunning() {
        return peakRunning.get();
    }

    public long completedCount() {
        return completed.get();
    }

    public int queuedCount() {
        return executor.getQueue().size();
    }

    /**
     * Stops accepting work, lets queued units finish for a short grace period, then interrupts.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler did not drain within 5s, interrupting {} workers", executor.getActiveCount());
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Concurrency scheduler stopped — {} units completed", completed.get());
    }
}
