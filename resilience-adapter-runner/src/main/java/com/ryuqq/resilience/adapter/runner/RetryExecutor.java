package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.DefaultErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.NetworkException;
import com.ryuqq.resilience.core.error.RateLimitedException;
import com.ryuqq.resilience.core.error.RetriesExhaustedException;
import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.error.SystemException;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.event.RetryScheduled;
import com.ryuqq.resilience.core.executor.Operation;
import com.ryuqq.resilience.core.model.CallAttemptResult;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * 분류 기반 재시도 실행기.
 *
 * <p>하나의 비동기 operation을 최대 {@code maxRetries + 1}회 시도합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>operation 실행 (시도별 attemptTimeout 적용, 초과 시 TIMEOUT)</li>
 *   <li>성공 → 결과 반환</li>
 *   <li>실패 → {@link ErrorClassifier}로 분류
 *     <ul>
 *       <li>VALIDATION, SYSTEM: 즉시 원래 오류로 실패 (재시도 없음)</li>
 *       <li>재시도 가능 + 시도 남음: 백오프 대기 후 재시도 ({@link RetryScheduled} 발행)</li>
 *       <li>재시도 가능 + 시도 소진: {@link RetriesExhaustedException}으로 실패</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>{@link RateLimitedException}이 쿼터 정보를 포함하면 {@link RateLimitTracker}에 반영합니다.</p>
 *
 * <p><strong>취소:</strong> 반환된 Future를 취소하면 진행 중인 시도 또는 백오프 대기가 취소되고
 * 다음 시도는 시작되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final ErrorClassifier classifier;
    private final RateLimitTracker rateLimitTracker;
    private final ResilienceEventListener listener;
    private final DoubleSupplier random;

    /**
     * 레지스트리 구성요소로 생성.
     *
     * @param registry Resilience 레지스트리
     */
    public RetryExecutor(ResilienceRegistry registry) {
        this(
            registry.getClock(),
            registry.getSleeper(),
            registry.getErrorClassifier(),
            registry.getRateLimitTracker(),
            registry.getEventListener(),
            registry.getRandom()
        );
    }

    /**
     * 생성자.
     *
     * @param clock 시간 원천
     * @param sleeper 백오프 대기
     * @param classifier 오류 분류기
     * @param rateLimitTracker Rate Limit 정보 반영 대상
     * @param listener 이벤트 수신자
     * @param random 백오프 jitter 난수 공급자 [0, 1)
     */
    public RetryExecutor(
        Clock clock,
        Sleeper sleeper,
        ErrorClassifier classifier,
        RateLimitTracker rateLimitTracker,
        ResilienceEventListener listener,
        DoubleSupplier random
    ) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        this.rateLimitTracker = Objects.requireNonNull(rateLimitTracker, "rateLimitTracker cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * 재시도 실행.
     *
     * @param key 의존성 키
     * @param operation 외부 호출
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return operation 결과 Future
     */
    public <T> CompletableFuture<T> executeWithRetry(DependencyKey key, Operation<T> operation, RetryPolicy policy) {
        CompletableFuture<RetryResult<T>> run = execute(key, operation, policy);
        CompletableFuture<T> value = run.thenApply(RetryResult::value);
        value.whenComplete((ignored, error) -> {
            if (value.isCancelled()) {
                run.cancel(true);
            }
        });
        return value;
    }

    /**
     * 재시도 실행 (시도 횟수와 이력 포함).
     *
     * @param key 의존성 키
     * @param operation 외부 호출
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return 재시도 결과 Future
     */
    public <T> CompletableFuture<RetryResult<T>> execute(DependencyKey key, Operation<T> operation, RetryPolicy policy) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        RetryLoop<T> loop = new RetryLoop<>(key, operation, policy);
        loop.attempt(1);
        return loop.result;
    }

    /**
     * 단일 호출의 재시도 상태.
     */
    private final class RetryLoop<T> {

        private final DependencyKey key;
        private final Operation<T> operation;
        private final RetryPolicy policy;
        private final BackoffCalculator backoff;
        private final Instant startedAt;
        private final List<CallAttemptResult> history = new ArrayList<>();
        private final CompletableFuture<RetryResult<T>> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> pending = new AtomicReference<>();

        private RetryLoop(DependencyKey key, Operation<T> operation, RetryPolicy policy) {
            this.key = key;
            this.operation = operation;
            this.policy = policy;
            this.backoff = new BackoffCalculator(policy, random);
            this.startedAt = clock.instant();
            result.whenComplete((ignored, error) -> {
                if (result.isCancelled()) {
                    CompletableFuture<?> current = pending.get();
                    if (current != null) {
                        current.cancel(true);
                    }
                    log.debug("Retry loop cancelled: key={}, attempts={}", key, history.size());
                }
            });
        }

        private void attempt(int attemptNumber) {
            if (result.isDone()) {
                return;
            }

            CompletableFuture<T> call = start();
            CompletableFuture<T> timed = call.copy()
                .orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
            track(timed);

            timed.whenComplete((value, error) -> {
                if (error != null) {
                    call.cancel(true);
                }
                if (result.isDone()) {
                    return;
                }
                try {
                    if (error == null) {
                        history.add(CallAttemptResult.succeeded(attemptNumber));
                        result.complete(new RetryResult<>(value, attemptNumber, history));
                    } else {
                        onFailure(attemptNumber, DefaultErrorClassifier.unwrap(error));
                    }
                } catch (RuntimeException e) {
                    result.completeExceptionally(new SystemException("Retry loop failed for " + key, e));
                }
            });
        }

        private CompletableFuture<T> start() {
            try {
                CompletionStage<T> stage = operation.call();
                if (stage == null) {
                    return CompletableFuture.failedFuture(
                        new SystemException("Operation returned null stage for " + key)
                    );
                }
                return stage.toCompletableFuture();
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void onFailure(int attemptNumber, Throwable cause) {
            Throwable error = cause;
            if (error instanceof TimeoutException) {
                error = NetworkException.timeout(
                    "Attempt " + attemptNumber + " for " + key + " timed out after "
                        + policy.attemptTimeout().toMillis() + "ms",
                    error
                );
            }
            ErrorKind kind = classifier.classify(error);
            feedRateLimit(error);

            if (!kind.isRetryable()) {
                history.add(CallAttemptResult.failed(kind, attemptNumber, 0));
                log.debug("Non-retryable failure: key={}, attempt={}, kind={}", key, attemptNumber, kind);
                result.completeExceptionally(error);
                return;
            }

            if (attemptNumber >= policy.maxAttempts()) {
                history.add(CallAttemptResult.failed(kind, attemptNumber, 0));
                Duration elapsed = Duration.between(startedAt, clock.instant());
                log.warn("Retries exhausted: key={}, attempts={}, elapsed={}ms, lastKind={}",
                    key, attemptNumber, elapsed.toMillis(), kind);
                result.completeExceptionally(new RetriesExhaustedException(
                    key.getValue(), attemptNumber, elapsed, history, kind, statusOf(error), error
                ));
                return;
            }

            Duration delay = kind == ErrorKind.RATE_LIMIT
                ? backoff.calculateRateLimit(attemptNumber, retryAfterOf(error))
                : backoff.calculate(attemptNumber);
            history.add(CallAttemptResult.failed(kind, attemptNumber, delay.toMillis()));
            log.warn("Retrying {}: attempt {}/{} failed ({}), next attempt in {}ms",
                key, attemptNumber, policy.maxAttempts(), kind, delay.toMillis());
            publish(new RetryScheduled(key, attemptNumber, kind, delay, clock.instant()));

            CompletableFuture<Void> sleep = sleeper.sleep(delay);
            track(sleep);
            sleep.whenComplete((ignored, sleepError) -> {
                if (sleepError != null) {
                    if (!result.isDone()) {
                        result.completeExceptionally(sleepError);
                    }
                    return;
                }
                attempt(attemptNumber + 1);
            });
        }

        private void track(CompletableFuture<?> future) {
            pending.set(future);
            if (result.isCancelled()) {
                future.cancel(true);
            }
        }

        private void feedRateLimit(Throwable error) {
            if (error instanceof RateLimitedException) {
                ((RateLimitedException) error).getRateLimitInfo().ifPresent(rateLimitTracker::update);
            }
        }

        private Duration retryAfterOf(Throwable error) {
            if (error instanceof RateLimitedException) {
                return ((RateLimitedException) error).getRetryAfter().orElse(null);
            }
            return null;
        }

        private Integer statusOf(Throwable error) {
            if (error instanceof ServiceException) {
                return ((ServiceException) error).getLastStatus();
            }
            return null;
        }

        private void publish(RetryScheduled event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed for retry: key={}", key, e);
            }
        }
    }
}
