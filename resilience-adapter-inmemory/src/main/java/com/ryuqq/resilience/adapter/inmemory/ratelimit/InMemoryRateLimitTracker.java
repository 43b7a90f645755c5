package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.event.RateLimitWait;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.protection.RateLimitInfo;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RateLimitTracker} SPI.
 *
 * <p><strong>Entry Lifecycle:</strong></p>
 * <ul>
 *   <li><strong>update:</strong> stores the entry, or merges it into a live entry keeping the later reset time</li>
 *   <li><strong>waitIfNeeded:</strong> clears expired entries, suspends through the {@link Sleeper} while the
 *       quota is exhausted, then clears the entry it waited on</li>
 * </ul>
 *
 * <p>Entries are removed with {@link ConcurrentHashMap#remove(Object, Object)}, so an entry replaced
 * by a newer response during a wait survives the wait.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryRateLimitTracker implements RateLimitTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimitTracker.class);

    private final ConcurrentHashMap<DependencyKey, RateLimitInfo> entries;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ResilienceEventListener listener;

    /**
     * Creates a tracker.
     *
     * @param clock time source
     * @param sleeper non-blocking sleep used for waits
     * @param listener receiver of {@link RateLimitWait} events
     */
    public InMemoryRateLimitTracker(Clock clock, Sleeper sleeper, ResilienceEventListener listener) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public void update(RateLimitInfo info) {
        Objects.requireNonNull(info, "info cannot be null");
        Instant now = clock.instant();
        RateLimitInfo stored = entries.compute(info.key(), (key, current) ->
            current == null || current.isExpired(now) ? info : current.mergeWith(info)
        );
        log.debug("Rate limit updated: key={}, requestsRemaining={}, tokensRemaining={}, resetTime={}",
            stored.key(), stored.requestsRemaining(), stored.tokensRemaining(), stored.resetTime());
    }

    @Override
    public CompletableFuture<Void> waitIfNeeded(DependencyKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        RateLimitInfo info = entries.get(key);
        if (info == null) {
            return CompletableFuture.completedFuture(null);
        }

        Instant now = clock.instant();
        if (info.isExpired(now)) {
            entries.remove(key, info);
            return CompletableFuture.completedFuture(null);
        }
        if (!info.isExhausted()) {
            return CompletableFuture.completedFuture(null);
        }

        Duration wait = Duration.between(now, info.resetTime());
        log.info("Rate limit exhausted, waiting: key={}, wait={}ms, resetTime={}", key, wait.toMillis(), info.resetTime());
        publish(new RateLimitWait(key, wait, info.resetTime(), now));

        CompletableFuture<Void> sleep = sleeper.sleep(wait);
        CompletableFuture<Void> result = sleep.thenRun(() -> entries.remove(key, info));
        result.whenComplete((ignored, error) -> {
            if (error instanceof CancellationException) {
                sleep.cancel(false);
            }
        });
        return result;
    }

    @Override
    public Optional<RateLimitInfo> status(DependencyKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Map<DependencyKey, RateLimitInfo> statuses() {
        return Map.copyOf(entries);
    }

    @Override
    public void clear(DependencyKey key) {
        entries.remove(key);
    }

    private void publish(RateLimitWait event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Event listener failed for rate limit wait: key={}", event.dependencyKey(), e);
        }
    }
}
