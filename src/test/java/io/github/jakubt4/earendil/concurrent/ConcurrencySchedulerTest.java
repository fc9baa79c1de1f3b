package io.github.jakubt4.earendil.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencySchedulerTest {

    private ConcurrencyScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void neverRunsMoreUnitsThanLimit() {
        scheduler = new ConcurrencyScheduler(4);
        final var concurrent = new AtomicInteger();
        final var observedMax = new AtomicInteger();

        final var futures = new ArrayList<CompletableFuture<Integer>>();
        for (var i = 0; i < 100; i++) {
            final var value = i;
            futures.add(scheduler.submit(() -> {
                observedMax.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                Thread.sleep(2);
                concurrent.decrementAndGet();
                return value;
            }));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        assertThat(futures).extracting(CompletableFuture::join).hasSize(100).doesNotHaveDuplicates();
        assertThat(observedMax.get()).isBetween(1, 4);
        assertThat(scheduler.peakRunning()).isBetween(1, 4);
        assertThat(scheduler.completedCount()).isEqualTo(100);
        assertThat(scheduler.running()).isZero();
    }

    @Test
    void failingUnitOnlyFailsItsOwnFuture() {
        scheduler = new ConcurrencyScheduler(2);

        final var failing = scheduler.<Integer>submit(() -> {
            throw new IllegalStateException("corrupt cell");
        });
        final var healthy = scheduler.submit(() -> 42);

        assertThat(healthy.join()).isEqualTo(42);
        assertThatThrownBy(failing::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("corrupt cell");
    }

    @Test
    void queuedUnitIsSkippedWhenCancelledBeforeItStarts() throws Exception {
        scheduler = new ConcurrencyScheduler(1);
        final var release = new CountDownLatch(1);
        final var started = new CountDownLatch(1);
        final var blocker = scheduler.submit(() -> {
            started.countDown();
            return release.await(5, TimeUnit.SECONDS);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        final var signal = CancellationSignal.create();
        final var ran = new AtomicBoolean();
        final var queued = scheduler.submit(signal, s -> {
            ran.set(true);
            return "ran";
        });
        assertThat(scheduler.queuedCount()).isEqualTo(1);

        signal.cancel();
        release.countDown();

        assertThat(blocker.join()).isTrue();
        assertThatThrownBy(queued::join).hasCauseInstanceOf(CancelledException.class);
        assertThat(ran).isFalse();
    }

    @Test
    void runningUnitObservesCancellationCooperatively() throws Exception {
        scheduler = new ConcurrencyScheduler(2);
        final var signal = CancellationSignal.create();
        final var started = new CountDownLatch(1);

        final var unit = scheduler.submit(signal, s -> {
            started.countDown();
            var iterations = 0;
            while (!s.isCancelled()) {
                iterations++;
                Thread.sleep(1);
            }
            return iterations;
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        signal.cancel();

        assertThat(unit.get(5, TimeUnit.SECONDS)).isNotNegative();
    }

    @Test
    void childSignalFollowsParentButNotViceVersa() {
        final var parent = CancellationSignal.create();
        final var child = parent.child();
        final var sibling = parent.child();

        assertThat(child.cancel()).isTrue();
        assertThat(child.cancel()).isFalse();
        assertThat(parent.isCancelled()).isFalse();
        assertThat(sibling.isCancelled()).isFalse();

        parent.cancel();
        assertThat(sibling.isCancelled()).isTrue();
        assertThat(sibling.child().isCancelled()).isTrue();
    }

    @Test
    void rejectsLimitBelowOne() {
        assertThatThrownBy(() -> new ConcurrencyScheduler(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
