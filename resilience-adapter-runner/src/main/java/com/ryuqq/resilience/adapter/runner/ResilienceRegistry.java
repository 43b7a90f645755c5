package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.breaker.InMemoryCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.cache.InMemoryResponseCache;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.InMemoryRateLimitTracker;
import com.ryuqq.resilience.core.error.DefaultErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorClassifier;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.protection.ResponseCache;
import com.ryuqq.resilience.core.spi.Sleeper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 공유 보호 상태 레지스트리.
 *
 * <p>Circuit Breaker, Rate Limit Tracker, Response Cache와 시간/대기/이벤트 구성요소를
 * 한 곳에 묶어 실행기에 명시적으로 주입합니다. 전역 싱글톤은 사용하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ResilienceRegistry registry = ResilienceRegistry.builder()
 *         .config(new ResilienceConfig().withCircuitBreaker(new CircuitBreakerConfig(3, Duration.ofSeconds(30))))
 *         .eventListener(new LoggingEventListener())
 *         .build()) {
 *     ResilientCallExecutor executor = new ResilientCallExecutor(registry);
 *     ...
 * }
 * }</pre>
 *
 * <p>레지스트리가 직접 만든 스케줄러와 이벤트 스레드는 {@link #close()}에서 종료됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceRegistry implements AutoCloseable {

    private final ResilienceConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ResilienceEventListener eventListener;
    private final ErrorClassifier errorClassifier;
    private final DoubleSupplier random;
    private final CircuitBreaker circuitBreaker;
    private final RateLimitTracker rateLimitTracker;
    private final ResponseCache responseCache;
    private final List<AutoCloseable> ownedResources;

    private ResilienceRegistry(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.errorClassifier = builder.errorClassifier;
        this.random = builder.random;
        this.ownedResources = new ArrayList<>();

        if (builder.sleeper != null) {
            this.sleeper = builder.sleeper;
        } else {
            ScheduledSleeper scheduledSleeper = new ScheduledSleeper();
            ownedResources.add(scheduledSleeper);
            this.sleeper = scheduledSleeper;
        }

        if (builder.listeners.isEmpty()) {
            this.eventListener = ResilienceEventListener.NO_OP;
        } else if (builder.eventExecutor != null) {
            this.eventListener = new AsyncEventPublisher(builder.eventExecutor, builder.listeners);
        } else {
            ExecutorService eventExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "resilience-events");
                thread.setDaemon(true);
                return thread;
            });
            ownedResources.add(eventExecutor::shutdown);
            this.eventListener = new AsyncEventPublisher(eventExecutor, builder.listeners);
        }

        this.circuitBreaker = builder.circuitBreaker != null
            ? builder.circuitBreaker
            : new InMemoryCircuitBreaker(config.circuitBreaker(), clock, eventListener);
        this.rateLimitTracker = builder.rateLimitTracker != null
            ? builder.rateLimitTracker
            : new InMemoryRateLimitTracker(clock, sleeper, eventListener);
        this.responseCache = builder.responseCache != null
            ? builder.responseCache
            : new InMemoryResponseCache(clock);
    }

    /**
     * 기본 설정의 인메모리 레지스트리 생성.
     *
     * @return ResilienceRegistry
     */
    public static ResilienceRegistry inMemory() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public ResilienceEventListener getEventListener() {
        return eventListener;
    }

    public ErrorClassifier getErrorClassifier() {
        return errorClassifier;
    }

    public DoubleSupplier getRandom() {
        return random;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RateLimitTracker getRateLimitTracker() {
        return rateLimitTracker;
    }

    public ResponseCache getResponseCache() {
        return responseCache;
    }

    /**
     * 레지스트리가 생성한 스케줄러와 이벤트 스레드를 종료합니다.
     */
    @Override
    public void close() {
        RuntimeException failure = null;
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = new IllegalStateException("Failed to close resilience registry", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        ownedResources.clear();
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * ResilienceRegistry 빌더.
     */
    public static final class Builder {

        private ResilienceConfig config = new ResilienceConfig();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper;
        private Executor eventExecutor;
        private final List<ResilienceEventListener> listeners = new ArrayList<>();
        private ErrorClassifier errorClassifier = DefaultErrorClassifier.INSTANCE;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private CircuitBreaker circuitBreaker;
        private RateLimitTracker rateLimitTracker;
        private ResponseCache responseCache;

        private Builder() {
        }

        public Builder config(ResilienceConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
            return this;
        }

        /**
         * 이벤트 전달 Executor 지정 (테스트에서는 {@code Runnable::run}).
         *
         * @param eventExecutor 이벤트 전달 Executor
         * @return this
         */
        public Builder eventExecutor(Executor eventExecutor) {
            this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor cannot be null");
            return this;
        }

        public Builder eventListener(ResilienceEventListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
            return this;
        }

        public Builder errorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier cannot be null");
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random cannot be null");
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
            return this;
        }

        public Builder rateLimitTracker(RateLimitTracker rateLimitTracker) {
            this.rateLimitTracker = Objects.requireNonNull(rateLimitTracker, "rateLimitTracker cannot be null");
            return this;
        }

        public Builder responseCache(ResponseCache responseCache) {
            this.responseCache = Objects.requireNonNull(responseCache, "responseCache cannot be null");
            return this;
        }

        public ResilienceRegistry build() {
            return new ResilienceRegistry(this);
        }
    }
}
