package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.spi.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Sleeper} that never blocks.
 *
 * <p>By default every sleep advances the {@link MutableClock} by the requested duration and
 * completes immediately. After {@link #hold()}, sleeps stay pending until {@link #releaseAll()}
 * so tests can observe or cancel an in-flight wait.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class InstantSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final List<Pending> pending = new CopyOnWriteArrayList<>();
    private volatile boolean holding;

    public InstantSleeper(MutableClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public CompletableFuture<Void> sleep(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        sleeps.add(duration);
        if (holding) {
            CompletableFuture<Void> future = new CompletableFuture<>();
            pending.add(new Pending(duration, future));
            return future;
        }
        if (!duration.isNegative()) {
            clock.advance(duration);
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Keeps subsequent sleeps pending until released.
     */
    public void hold() {
        holding = true;
    }

    /**
     * Advances the clock for every pending sleep and completes them.
     * Cancelled sleeps are dropped without moving the clock.
     */
    public void releaseAll() {
        holding = false;
        List<Pending> snapshot = new ArrayList<>(pending);
        pending.clear();
        for (Pending entry : snapshot) {
            if (entry.future().isCancelled()) {
                continue;
            }
            clock.advance(entry.duration());
            entry.future().complete(null);
        }
    }

    /**
     * Returns every requested sleep duration in order.
     *
     * @return recorded durations
     */
    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    /**
     * Returns the futures of sleeps still pending.
     *
     * @return pending sleep futures
     */
    public List<CompletableFuture<Void>> pendingSleeps() {
        return pending.stream().map(Pending::future).toList();
    }

    public void reset() {
        sleeps.clear();
        pending.clear();
        holding = false;
    }

    private record Pending(Duration duration, CompletableFuture<Void> future) {
    }
}
