package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.call.CallRequest;
import com.ryuqq.resilience.application.call.CallResult;
import com.ryuqq.resilience.application.call.CallSource;
import com.ryuqq.resilience.core.error.DefaultErrorClassifier;
import com.ryuqq.resilience.core.error.NetworkException;
import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.error.SystemException;
import com.ryuqq.resilience.core.error.ValidationException;
import com.ryuqq.resilience.core.event.CacheHit;
import com.ryuqq.resilience.core.event.CacheMiss;
import com.ryuqq.resilience.core.event.FallbackUsed;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.executor.Operation;
import com.ryuqq.resilience.core.fallback.FallbackContext;
import com.ryuqq.resilience.core.fallback.FallbackPolicy;
import com.ryuqq.resilience.core.fallback.FallbackReason;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.protection.ResponseCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ResilientCallExecutor 유닛 테스트.
 *
 * <p>보호 구성요소를 Mock으로 대체하고 호출 경로의 분기만 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResilientCallExecutorTest {

    private static final String KEY_VALUE = "search-api";
    private static final DependencyKey KEY = DependencyKey.of(KEY_VALUE);
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private CircuitBreaker circuitBreaker;

    @Mock
    private RateLimitTracker rateLimitTracker;

    @Mock
    private ResponseCache responseCache;

    @Mock
    private ResilienceEventListener listener;

    private ResilienceRegistry registry;
    private ResilientCallExecutor executor;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        registry = registry(new ResilienceConfig());
        executor = new ResilientCallExecutor(registry);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // ============================================================
    // 1. 성공 경로
    // ============================================================

    @Test
    void execute_성공_시_LIVE_결과와_Circuit_reset() {
        // given
        givenNoRateLimit();

        // when
        CallResult<String> result = executor.execute(request(succeeding("value")).build()).join();

        // then
        assertThat(result.getSource()).isEqualTo(CallSource.LIVE);
        assertThat(result.getValue()).isEqualTo("value");
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.isDegraded()).isFalse();
        verify(circuitBreaker).reset(KEY);
        verify(circuitBreaker, never()).recordFailure(any());
        verifyNoInteractions(responseCache);
    }

    @Test
    void execute_cacheKey가_있으면_결과를_요청_TTL로_저장() {
        // given
        givenNoRateLimit();
        when(responseCache.get("search:q=java")).thenReturn(Optional.empty());

        // when
        executor.execute(request(succeeding("value"))
            .cacheKey("search:q=java")
            .cacheTtl(Duration.ofMinutes(10))
            .build()).join();

        // then
        verify(responseCache).set("search:q=java", "value", Duration.ofMinutes(10));
        verify(listener).onEvent(any(CacheMiss.class));
    }

    @Test
    void execute_TTL_미지정_시_기본_30분_적용() {
        // given
        givenNoRateLimit();
        when(responseCache.get("k")).thenReturn(Optional.empty());

        // when
        executor.execute(request(succeeding("value")).cacheKey("k").build()).join();

        // then
        verify(responseCache).set("k", "value", Duration.ofMinutes(30));
    }

    @Test
    void execute_null_결과는_캐시하지_않음() {
        // given
        givenNoRateLimit();
        when(responseCache.get("k")).thenReturn(Optional.empty());

        // when
        CallResult<String> result = executor.execute(request(succeeding(null)).cacheKey("k").build()).join();

        // then
        assertThat(result.getValue()).isNull();
        verify(responseCache, never()).set(anyString(), any(), any());
    }

    @Test
    void execute_캐시_적중_시_operation_미호출() {
        // given
        when(responseCache.get("k")).thenReturn(Optional.of("cached"));

        // when
        CallResult<String> result = executor.execute(request(succeeding("live")).cacheKey("k").build()).join();

        // then
        assertThat(result.getSource()).isEqualTo(CallSource.CACHED);
        assertThat(result.getValue()).isEqualTo("cached");
        assertThat(result.getAttempts()).isZero();
        assertThat(calls).hasValue(0);
        verifyNoInteractions(circuitBreaker, rateLimitTracker);
        verify(listener).onEvent(any(CacheHit.class));
    }

    // ============================================================
    // 2. Circuit OPEN
    // ============================================================

    @Test
    void execute_Circuit_OPEN이면_operation_없이_Fallback() {
        // given
        when(circuitBreaker.isOpen(KEY)).thenReturn(true);
        AtomicReference<FallbackContext> seen = new AtomicReference<>();
        FallbackPolicy<String> fallback = FallbackPolicy.of(context -> {
            seen.set(context);
            return "template";
        });

        // when
        CallResult<String> result = executor.execute(request(succeeding("live")).fallback(fallback).build()).join();

        // then
        assertThat(result.getSource()).isEqualTo(CallSource.FALLBACK);
        assertThat(result.getValue()).isEqualTo("template");
        assertThat(result.getDegradedReason()).contains(FallbackReason.CIRCUIT_OPEN);
        assertThat(result.getAttempts()).isZero();
        assertThat(seen.get().reason()).isEqualTo(FallbackReason.CIRCUIT_OPEN);
        assertThat(seen.get().error()).isEmpty();
        assertThat(calls).hasValue(0);
        verify(circuitBreaker).recordFailure(KEY);
        verifyNoInteractions(rateLimitTracker);
        verify(listener).onEvent(any(FallbackUsed.class));
    }

    @Test
    void execute_Circuit_OPEN이고_Fallback_없으면_ServiceException() {
        // given
        when(circuitBreaker.isOpen(KEY)).thenReturn(true);

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(request(succeeding("live")).build());

        // then
        ServiceException error = failureOf(future, ServiceException.class);
        assertThat(error.getDependencyKey()).isEqualTo(KEY_VALUE);
        assertThat(error.getAttempts()).isZero();
        assertThat(error.isRetryable()).isTrue();
    }

    @Test
    void execute_차단_실패_기록_비활성화_시_recordFailure_생략() {
        // given
        registry.close();
        registry = registry(new ResilienceConfig().withRecordShortCircuitAsFailure(false));
        executor = new ResilientCallExecutor(registry);
        when(circuitBreaker.isOpen(KEY)).thenReturn(true);

        // when
        executor.execute(request(succeeding("live")).fallback(FallbackPolicy.value("fb")).build()).join();

        // then
        verify(circuitBreaker, never()).recordFailure(any());
    }

    // ============================================================
    // 3. 재시도 소진
    // ============================================================

    @Test
    void execute_재시도_소진_시_recordFailure_후_Fallback() {
        // given
        givenNoRateLimit();
        FallbackPolicy<String> fallback = FallbackPolicy.of(context -> "fallback after " + context.attempts());

        // when
        CallResult<String> result = executor.execute(request(failing(new NetworkException("down")))
            .retryPolicy(new RetryPolicy().withMaxRetries(1))
            .fallback(fallback)
            .build()).join();

        // then
        assertThat(result.getSource()).isEqualTo(CallSource.FALLBACK);
        assertThat(result.getValue()).isEqualTo("fallback after 2");
        assertThat(result.getDegradedReason()).contains(FallbackReason.RETRIES_EXHAUSTED);
        assertThat(calls).hasValue(2);
        verify(circuitBreaker).recordFailure(KEY);
        verify(circuitBreaker, never()).reset(any());
    }

    @Test
    void execute_UncheckedIOException은_NETWORK로_재시도_후_Fallback() {
        // given
        givenNoRateLimit();
        UncheckedIOException connectionReset = new UncheckedIOException(new IOException("connection reset"));

        // when
        CallResult<String> result = executor.execute(request(failing(connectionReset))
            .retryPolicy(new RetryPolicy().withMaxRetries(3))
            .fallback(FallbackPolicy.value("degraded"))
            .build()).join();

        // then
        assertThat(result.getSource()).isEqualTo(CallSource.FALLBACK);
        assertThat(result.getValue()).isEqualTo("degraded");
        assertThat(result.getDegradedReason()).contains(FallbackReason.RETRIES_EXHAUSTED);
        assertThat(calls).hasValue(4);
        verify(circuitBreaker).recordFailure(KEY);
    }

    @Test
    void execute_재시도_소진_Fallback_없으면_lastStatus_포함_ServiceException() {
        // given
        givenNoRateLimit();

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(failing(new ServiceException("unavailable", 503)))
                .retryPolicy(new RetryPolicy().withMaxRetries(2))
                .build()
        );

        // then
        ServiceException error = failureOf(future, ServiceException.class);
        assertThat(error.getAttempts()).isEqualTo(3);
        assertThat(error.getLastStatus()).isEqualTo(503);
        assertThat(error.isRetryable()).isTrue();
    }

    @Test
    void execute_Fallback_실패_시_ServiceException에_suppressed로_첨부() {
        // given
        givenNoRateLimit();
        IllegalStateException fallbackError = new IllegalStateException("template missing");
        FallbackPolicy<String> fallback = context -> CompletableFuture.failedFuture(fallbackError);

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(failing(new NetworkException("down")))
                .retryPolicy(new RetryPolicy().withMaxRetries(0))
                .fallback(fallback)
                .build()
        );

        // then
        ServiceException error = failureOf(future, ServiceException.class);
        assertThat(error.getSuppressed()).containsExactly(fallbackError);
        verify(listener, never()).onEvent(any(FallbackUsed.class));
    }

    // ============================================================
    // 4. VALIDATION / SYSTEM
    // ============================================================

    @Test
    void execute_VALIDATION_오류는_Circuit과_Fallback_우회() {
        // given
        givenNoRateLimit();

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(failing(new ValidationException("prompt too long")))
                .fallback(FallbackPolicy.value("fb"))
                .build()
        );

        // then
        failureOf(future, ValidationException.class);
        assertThat(calls).hasValue(1);
        verify(circuitBreaker, never()).recordFailure(any());
        verify(circuitBreaker, never()).reset(any());
    }

    @Test
    void execute_IllegalArgumentException은_ValidationException으로_감쌈() {
        // given
        givenNoRateLimit();

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(failing(new IllegalArgumentException("bad input"))).build()
        );

        // then
        ValidationException error = failureOf(future, ValidationException.class);
        assertThat(error.getCause()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void execute_SYSTEM_오류는_SystemException으로_실패() {
        // given
        givenNoRateLimit();

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(failing(new IllegalStateException("bug")))
                .fallback(FallbackPolicy.value("fb"))
                .build()
        );

        // then
        SystemException error = failureOf(future, SystemException.class);
        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
        verify(circuitBreaker, never()).recordFailure(any());
    }

    @Test
    void execute_null_요청은_동기_ValidationException() {
        // when & then
        assertThatThrownBy(() -> executor.execute(null))
            .isInstanceOf(ValidationException.class);
    }

    // ============================================================
    // 5. Rate Limit 대기와 취소
    // ============================================================

    @Test
    void execute_RateLimit_대기_완료_전에는_operation_미호출() {
        // given
        CompletableFuture<Void> wait = new CompletableFuture<>();
        when(rateLimitTracker.waitIfNeeded(KEY)).thenReturn(wait);

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(request(succeeding("value")).build());

        // then
        assertThat(calls).hasValue(0);
        wait.complete(null);
        assertThat(future.join().getValue()).isEqualTo("value");
        assertThat(calls).hasValue(1);
    }

    @Test
    void execute_취소_시_대기_취소되고_실패로_기록되지_않음() {
        // given
        CompletableFuture<Void> wait = new CompletableFuture<>();
        when(rateLimitTracker.waitIfNeeded(KEY)).thenReturn(wait);

        // when
        CompletableFuture<CallResult<String>> future = executor.execute(
            request(succeeding("value")).fallback(FallbackPolicy.value("fb")).build()
        );
        future.cancel(true);

        // then
        assertThat(wait).isCancelled();
        assertThat(calls).hasValue(0);
        verify(circuitBreaker, never()).recordFailure(any());
        verify(circuitBreaker, never()).reset(any());
    }

    private ResilienceRegistry registry(ResilienceConfig config) {
        return ResilienceRegistry.builder()
            .config(config)
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .sleeper(duration -> CompletableFuture.completedFuture(null))
            .random(() -> 0.0)
            .eventExecutor(Runnable::run)
            .eventListener(listener)
            .circuitBreaker(circuitBreaker)
            .rateLimitTracker(rateLimitTracker)
            .responseCache(responseCache)
            .build();
    }

    private void givenNoRateLimit() {
        when(rateLimitTracker.waitIfNeeded(KEY)).thenReturn(CompletableFuture.completedFuture(null));
    }

    private CallRequest.Builder<String> request(Operation<String> operation) {
        return CallRequest.builder(KEY_VALUE, operation);
    }

    private Operation<String> succeeding(String value) {
        return () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(value);
        };
    }

    private Operation<String> failing(Exception error) {
        return () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        };
    }

    private static <E extends Throwable> E failureOf(CompletableFuture<?> future, Class<E> type) {
        Throwable[] holder = new Throwable[1];
        future.handle((value, error) -> {
            holder[0] = error;
            return null;
        }).join();
        Throwable cause = DefaultErrorClassifier.unwrap(holder[0]);
        assertThat(cause).isInstanceOf(type);
        return type.cast(cause);
    }
}
