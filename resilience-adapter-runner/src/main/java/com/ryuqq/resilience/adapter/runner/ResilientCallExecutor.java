package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.call.CallOrchestrator;
import com.ryuqq.resilience.application.call.CallRequest;
import com.ryuqq.resilience.application.call.CallResult;
import com.ryuqq.resilience.core.error.DefaultErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.RetriesExhaustedException;
import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.error.SystemException;
import com.ryuqq.resilience.core.error.ValidationException;
import com.ryuqq.resilience.core.event.CacheHit;
import com.ryuqq.resilience.core.event.CacheMiss;
import com.ryuqq.resilience.core.event.FallbackUsed;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.fallback.FallbackContext;
import com.ryuqq.resilience.core.fallback.FallbackPolicy;
import com.ryuqq.resilience.core.fallback.FallbackReason;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.protection.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resilient Call Executor 구현체.
 *
 * <p>외부 의존성 호출 하나를 캐시, Circuit Breaker, Rate Limit, 재시도, Fallback으로 감쌉니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 검증 (실패 시 {@link ValidationException} 동기 throw)</li>
 *   <li>cacheKey가 있으면 캐시 조회 → 적중 시 CACHED 결과 즉시 반환</li>
 *   <li>Circuit OPEN → 호출 생략, 7단계로 이동 (reason=CIRCUIT_OPEN)</li>
 *   <li>{@link RateLimitTracker#waitIfNeeded} 대기</li>
 *   <li>{@link RetryExecutor}로 재시도 실행</li>
 *   <li>성공 → Circuit reset, 캐시 저장, LIVE 결과 반환</li>
 *   <li>실패 → recordFailure, Fallback 있으면 FALLBACK 결과, 없으면 {@link ServiceException}</li>
 * </ol>
 *
 * <p><strong>예외 경로:</strong></p>
 * <ul>
 *   <li>VALIDATION: 재시도, Circuit 기록, Fallback 모두 생략하고 {@link ValidationException}으로 실패</li>
 *   <li>SYSTEM: 동일하게 생략하고 {@link SystemException}으로 실패 (ERROR 로그)</li>
 *   <li>취소: 반환된 Future 취소 시 대기/재시도가 취소되며 성공도 실패도 아님</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilientCallExecutor implements CallOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResilientCallExecutor.class);

    private final ResilienceConfig config;
    private final Clock clock;
    private final CircuitBreaker circuitBreaker;
    private final RateLimitTracker rateLimitTracker;
    private final ResponseCache responseCache;
    private final ErrorClassifier classifier;
    private final ResilienceEventListener listener;
    private final RetryExecutor retryExecutor;

    /**
     * 생성자.
     *
     * @param registry 공유 보호 상태 레지스트리
     */
    public ResilientCallExecutor(ResilienceRegistry registry) {
        this(registry, new RetryExecutor(registry));
    }

    /**
     * 생성자 (RetryExecutor 주입).
     *
     * @param registry 공유 보호 상태 레지스트리
     * @param retryExecutor 재시도 실행기
     */
    public ResilientCallExecutor(ResilienceRegistry registry, RetryExecutor retryExecutor) {
        Objects.requireNonNull(registry, "registry cannot be null");
        this.config = registry.getConfig();
        this.clock = registry.getClock();
        this.circuitBreaker = registry.getCircuitBreaker();
        this.rateLimitTracker = registry.getRateLimitTracker();
        this.responseCache = registry.getResponseCache();
        this.classifier = registry.getErrorClassifier();
        this.listener = registry.getEventListener();
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
    }

    @Override
    public <T> CompletableFuture<CallResult<T>> execute(CallRequest<T> request) {
        if (request == null) {
            throw new ValidationException("request cannot be null");
        }

        DependencyKey key = request.getDependencyKey();
        Instant startedAt = clock.instant();

        Optional<CallResult<T>> cached = lookupCache(request);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<CallResult<T>> result = new CompletableFuture<>();

        if (circuitBreaker.isOpen(key)) {
            log.warn("Circuit open, skipping call: key={}", key);
            if (config.recordShortCircuitAsFailure()) {
                circuitBreaker.recordFailure(key);
            }
            degrade(request, FallbackReason.CIRCUIT_OPEN, 0, null, null, startedAt, result);
            return result;
        }

        AtomicReference<CompletableFuture<?>> pending = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                CompletableFuture<?> current = pending.get();
                if (current != null) {
                    current.cancel(true);
                }
                log.debug("Call cancelled: key={}", key);
            }
        });

        RetryPolicy policy = request.getRetryPolicy().orElse(config.retryPolicy());
        CompletableFuture<Void> wait = rateLimitTracker.waitIfNeeded(key);
        pending.set(wait);

        wait.whenComplete((ignored, waitError) -> {
            if (result.isDone()) {
                return;
            }
            if (waitError != null) {
                result.completeExceptionally(DefaultErrorClassifier.unwrap(waitError));
                return;
            }
            CompletableFuture<RetryResult<T>> run = retryExecutor.execute(key, request.getOperation(), policy);
            pending.set(run);
            if (result.isCancelled()) {
                run.cancel(true);
                return;
            }
            run.whenComplete((retryResult, error) -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    if (error == null) {
                        onSuccess(request, retryResult, startedAt, result);
                    } else {
                        onFailure(request, DefaultErrorClassifier.unwrap(error), startedAt, result);
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected failure while completing call: key={}", key, e);
                    result.completeExceptionally(new SystemException("Call completion failed for " + key, e));
                }
            });
        });

        return result;
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<CallResult<T>> lookupCache(CallRequest<T> request) {
        Optional<String> cacheKey = request.getCacheKey();
        if (cacheKey.isEmpty()) {
            return Optional.empty();
        }
        DependencyKey key = request.getDependencyKey();
        Optional<Object> hit = responseCache.get(cacheKey.get());
        if (hit.isPresent()) {
            log.debug("Cache hit: key={}, cacheKey={}", key, cacheKey.get());
            publish(new CacheHit(key, cacheKey.get(), clock.instant()));
            return Optional.of(CallResult.cached((T) hit.get()));
        }
        publish(new CacheMiss(key, cacheKey.get(), clock.instant()));
        return Optional.empty();
    }

    private <T> void onSuccess(
        CallRequest<T> request,
        RetryResult<T> retryResult,
        Instant startedAt,
        CompletableFuture<CallResult<T>> result
    ) {
        DependencyKey key = request.getDependencyKey();
        circuitBreaker.reset(key);

        T value = retryResult.value();
        request.getCacheKey().ifPresent(cacheKey -> {
            if (value == null) {
                log.debug("Null result not cached: key={}, cacheKey={}", key, cacheKey);
                return;
            }
            Duration ttl = request.getCacheTtl().orElse(config.cache().defaultTtl());
            responseCache.set(cacheKey, value, ttl);
        });

        result.complete(CallResult.live(value, retryResult.attempts(), elapsedSince(startedAt)));
    }

    private <T> void onFailure(
        CallRequest<T> request,
        Throwable error,
        Instant startedAt,
        CompletableFuture<CallResult<T>> result
    ) {
        DependencyKey key = request.getDependencyKey();

        if (error instanceof CancellationException) {
            result.completeExceptionally(error);
            return;
        }

        ErrorKind kind = classifier.classify(error);
        if (kind == ErrorKind.VALIDATION) {
            result.completeExceptionally(error instanceof ValidationException
                ? error
                : new ValidationException(describe(error), error));
            return;
        }
        if (kind == ErrorKind.SYSTEM) {
            log.error("System error calling {}, not retried", key, error);
            result.completeExceptionally(error instanceof SystemException
                ? error
                : new SystemException("System error calling " + key + ": " + describe(error), error));
            return;
        }

        if (kind.isDependencyFailure()) {
            circuitBreaker.recordFailure(key);
        }

        int attempts = 1;
        Integer lastStatus = null;
        Throwable cause = error;
        if (error instanceof RetriesExhaustedException exhausted) {
            attempts = exhausted.getAttempts();
            lastStatus = exhausted.getLastStatus();
        } else if (error instanceof ServiceException service) {
            lastStatus = service.getLastStatus();
        }
        degrade(request, FallbackReason.RETRIES_EXHAUSTED, attempts, lastStatus, cause, startedAt, result);
    }

    private <T> void degrade(
        CallRequest<T> request,
        FallbackReason reason,
        int attempts,
        Integer lastStatus,
        Throwable cause,
        Instant startedAt,
        CompletableFuture<CallResult<T>> result
    ) {
        DependencyKey key = request.getDependencyKey();
        ServiceException failure = ServiceException.unavailable(key.getValue(), attempts, lastStatus, cause);

        Optional<FallbackPolicy<T>> fallback = request.getFallback();
        if (fallback.isEmpty()) {
            log.warn("Call failed without fallback: key={}, reason={}, attempts={}, lastStatus={}",
                key, reason, attempts, lastStatus);
            result.completeExceptionally(failure);
            return;
        }

        FallbackContext context = new FallbackContext(key, reason, attempts, cause, request.getContext());
        FallbackPolicy.invoke(fallback.get(), context).whenComplete((value, fallbackError) -> {
            if (result.isDone()) {
                return;
            }
            if (fallbackError != null) {
                Throwable unwrapped = DefaultErrorClassifier.unwrap(fallbackError);
                failure.addSuppressed(unwrapped);
                log.error("Fallback failed: key={}, reason={}", key, reason, unwrapped);
                result.completeExceptionally(failure);
                return;
            }
            log.warn("Degraded to fallback: key={}, reason={}, attempts={}", key, reason, attempts);
            publish(new FallbackUsed(key, reason, attempts, clock.instant()));
            result.complete(CallResult.fallback(value, reason, attempts, elapsedSince(startedAt)));
        });
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void publish(ResilienceEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Event listener failed: type={}, key={}",
                event.getClass().getSimpleName(), event.dependencyKey(), e);
        }
    }
}
