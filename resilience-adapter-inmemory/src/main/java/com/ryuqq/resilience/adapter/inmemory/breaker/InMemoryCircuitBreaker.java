package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.event.CircuitStateChanged;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CircuitBreaker} SPI.
 *
 * <p>Keeps one immutable state value per dependency key in a {@link ConcurrentHashMap}.
 * Every read-modify-write runs inside {@link ConcurrentHashMap#compute}, so updates for the
 * same key are serialized while different keys never contend.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <ul>
 *   <li><strong>CLOSED:</strong> failures are counted; reaching the threshold opens the circuit</li>
 *   <li><strong>OPEN:</strong> {@code isOpen} returns true until {@code now - lastFailure >= openTimeout}</li>
 *   <li><strong>HALF_OPEN:</strong> exactly one trial call is let through. A trial that reports no outcome
 *       within another {@code openTimeout} is considered lost and a new trial is permitted</li>
 * </ul>
 *
 * <p>State transitions are logged and published as {@link CircuitStateChanged} events.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * CircuitBreaker breaker = new InMemoryCircuitBreaker(
 *     new CircuitBreakerConfig().withFailureThreshold(3),
 *     Clock.systemUTC(),
 *     eventPublisher
 * );
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    /**
     * Breaker state per dependency key, created lazily on the first recorded failure.
     */
    private final ConcurrentHashMap<DependencyKey, BreakerState> states;

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventListener listener;

    /**
     * Creates a breaker with default configuration (threshold 5, open timeout 60s).
     */
    public InMemoryCircuitBreaker() {
        this(new CircuitBreakerConfig());
    }

    /**
     * Creates a breaker with custom configuration, system clock and no event listener.
     *
     * @param config breaker configuration
     */
    public InMemoryCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), ResilienceEventListener.NO_OP);
    }

    /**
     * Creates a breaker.
     *
     * @param config breaker configuration
     * @param clock time source
     * @param listener receiver of state transition events
     */
    public InMemoryCircuitBreaker(CircuitBreakerConfig config, Clock clock, ResilienceEventListener listener) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.states = new ConcurrentHashMap<>();
    }

    @Override
    public boolean isOpen(DependencyKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        Instant now = clock.instant();
        Decision decision = new Decision();

        states.computeIfPresent(key, (k, current) -> {
            decision.from = current.state();
            decision.failureCount = current.failureCount();
            switch (current.state()) {
                case OPEN:
                    if (elapsed(current.lastFailureTime(), now)) {
                        decision.open = false;
                        return current.toHalfOpen(now);
                    }
                    decision.open = true;
                    return current;
                case HALF_OPEN:
                    if (current.trialStartedAt() != null && !elapsed(current.trialStartedAt(), now)) {
                        decision.open = true;
                        return current;
                    }
                    decision.open = false;
                    return current.toHalfOpen(now);
                default:
                    decision.open = false;
                    return current;
            }
        });

        if (decision.from == CircuitBreakerState.OPEN && !decision.open) {
            onTransition(key, CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, decision.failureCount, now);
        }
        return decision.open;
    }

    @Override
    public void recordFailure(DependencyKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        Instant now = clock.instant();
        Decision decision = new Decision();

        BreakerState updated = states.compute(key, (k, current) -> {
            BreakerState base = current == null ? BreakerState.initial() : current;
            decision.from = base.state();
            int failureCount = base.failureCount() + 1;
            CircuitBreakerState next = base.state();
            if (base.state() == CircuitBreakerState.HALF_OPEN || failureCount >= config.failureThreshold()) {
                next = CircuitBreakerState.OPEN;
            }
            return new BreakerState(next, failureCount, now, null);
        });

        if (decision.from != updated.state()) {
            onTransition(key, decision.from, updated.state(), updated.failureCount(), now);
        } else {
            log.debug("Failure recorded: key={}, state={}, failureCount={}", key, updated.state(), updated.failureCount());
        }
    }

    @Override
    public void reset(DependencyKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        Decision decision = new Decision();

        states.computeIfPresent(key, (k, current) -> {
            decision.from = current.state();
            if (current.state() == CircuitBreakerState.CLOSED && current.failureCount() == 0) {
                return current;
            }
            return new BreakerState(CircuitBreakerState.CLOSED, 0, current.lastFailureTime(), null);
        });

        if (decision.from != null && decision.from != CircuitBreakerState.CLOSED) {
            onTransition(key, decision.from, CircuitBreakerState.CLOSED, 0, clock.instant());
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot(DependencyKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        BreakerState state = states.get(key);
        return state == null ? CircuitBreakerSnapshot.closed(key) : state.toSnapshot(key);
    }

    @Override
    public Map<DependencyKey, CircuitBreakerSnapshot> snapshots() {
        return states.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().toSnapshot(e.getKey())));
    }

    /**
     * Removes all breaker state.
     */
    public void clear() {
        states.clear();
    }

    private boolean elapsed(Instant since, Instant now) {
        return Duration.between(since, now).compareTo(config.openTimeout()) >= 0;
    }

    private void onTransition(
        DependencyKey key,
        CircuitBreakerState from,
        CircuitBreakerState to,
        int failureCount,
        Instant now
    ) {
        if (to == CircuitBreakerState.OPEN) {
            log.warn("Circuit opened: key={}, from={}, failureCount={}, openTimeout={}",
                key, from, failureCount, config.openTimeout());
        } else {
            log.info("Circuit state changed: key={}, {} -> {}", key, from, to);
        }
        try {
            listener.onEvent(new CircuitStateChanged(key, from, to, failureCount, now));
        } catch (RuntimeException e) {
            log.error("Event listener failed for circuit transition: key={}, {} -> {}", key, from, to, e);
        }
    }

    /**
     * Outcome of a compute block, written inside the lock and read after it.
     */
    private static final class Decision {
        private CircuitBreakerState from;
        private int failureCount;
        private boolean open;
    }

    /**
     * Immutable per-key breaker state.
     *
     * @param state current state
     * @param failureCount failures since the last reset
     * @param lastFailureTime time of the last recorded failure (null before any failure)
     * @param trialStartedAt time the current HALF_OPEN trial was granted (null outside HALF_OPEN)
     */
    private record BreakerState(
        CircuitBreakerState state,
        int failureCount,
        Instant lastFailureTime,
        Instant trialStartedAt
    ) {

        static BreakerState initial() {
            return new BreakerState(CircuitBreakerState.CLOSED, 0, null, null);
        }

        BreakerState toHalfOpen(Instant now) {
            return new BreakerState(CircuitBreakerState.HALF_OPEN, failureCount, lastFailureTime, now);
        }

        CircuitBreakerSnapshot toSnapshot(DependencyKey key) {
            return new CircuitBreakerSnapshot(key, state, failureCount, lastFailureTime);
        }
    }
}
