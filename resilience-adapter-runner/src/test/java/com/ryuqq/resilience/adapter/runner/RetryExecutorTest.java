package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.DefaultErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.NetworkException;
import com.ryuqq.resilience.core.error.RateLimitedException;
import com.ryuqq.resilience.core.error.RetriesExhaustedException;
import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.error.SystemException;
import com.ryuqq.resilience.core.error.ValidationException;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.event.RetryScheduled;
import com.ryuqq.resilience.core.executor.Operation;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.RateLimitInfo;
import com.ryuqq.resilience.core.protection.RateLimitTracker;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RetryExecutor 유닛 테스트.
 *
 * <p>분류 기반 재시도 규칙을 검증합니다:</p>
 * <ul>
 *   <li>재시도 가능 오류는 maxRetries까지 백오프 후 재시도</li>
 *   <li>VALIDATION/SYSTEM 오류는 단 1회 시도</li>
 *   <li>Rate Limit 힌트와 쿼터 정보 반영</li>
 *   <li>시도별 timeout과 취소</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    private static final DependencyKey KEY = DependencyKey.of("search-api");
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private RateLimitTracker rateLimitTracker;

    @Mock
    private ResilienceEventListener listener;

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = duration -> {
        sleeps.add(duration);
        return CompletableFuture.completedFuture(null);
    };

    private RetryExecutor retryExecutor;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        retryExecutor = new RetryExecutor(
            Clock.fixed(NOW, ZoneOffset.UTC),
            sleeper,
            DefaultErrorClassifier.INSTANCE,
            rateLimitTracker,
            listener,
            () -> 0.0
        );
        policy = new RetryPolicy().withMaxRetries(3);
    }

    @Test
    void 첫_시도_성공_시_재시도_없음() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        };

        // when
        RetryResult<String> result = retryExecutor.execute(KEY, operation, policy).join();

        // then
        assertThat(result.value()).isEqualTo("ok");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void 두_번_실패_후_성공_시_지수_백오프_적용() {
        // given
        Operation<String> operation = failingTimes(2, () -> new NetworkException("connection reset"), "done");

        // when
        RetryResult<String> result = retryExecutor.execute(KEY, operation, policy).join();

        // then
        assertThat(result.value()).isEqualTo("done");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.history()).hasSize(3);
        assertThat(result.history().get(2).success()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void 재시도_예약_시_RetryScheduled_이벤트_발행() {
        // given
        Operation<String> operation = failingTimes(1, () -> new ServiceException("bad gateway", 502), "done");
        ArgumentCaptor<RetryScheduled> captor = ArgumentCaptor.forClass(RetryScheduled.class);

        // when
        retryExecutor.execute(KEY, operation, policy).join();

        // then
        verify(listener).onEvent(captor.capture());
        RetryScheduled event = captor.getValue();
        assertThat(event.dependencyKey()).isEqualTo(KEY);
        assertThat(event.failedAttempt()).isEqualTo(1);
        assertThat(event.errorKind()).isEqualTo(ErrorKind.SERVICE);
        assertThat(event.delay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void 재시도_소진_시_RetriesExhaustedException() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new ServiceException("unavailable", 503));
        };

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, policy.withMaxRetries(2));

        // then
        assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(RetriesExhaustedException.class);
        RetriesExhaustedException exhausted = (RetriesExhaustedException) DefaultErrorClassifier.unwrap(
            catchFailure(future)
        );
        assertThat(exhausted.getAttempts()).isEqualTo(3);
        assertThat(exhausted.getHistory()).hasSize(3);
        assertThat(exhausted.getLastStatus()).isEqualTo(503);
        assertThat(exhausted.kind()).isEqualTo(ErrorKind.SERVICE);
        assertThat(exhausted.getCause()).isInstanceOf(ServiceException.class);
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void maxRetries_0이면_단_1회_시도() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new NetworkException("down"));
        };

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, policy.withMaxRetries(0));

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(RetriesExhaustedException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void VALIDATION_오류는_재시도_없이_원래_예외로_실패() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new ValidationException("bad request"));
        };

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, policy);

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(ValidationException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
        verify(listener, never()).onEvent(any());
    }

    @Test
    void SYSTEM_오류는_재시도_없음() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        };

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, policy);

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void 동기_IOException도_NETWORK으로_재시도() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("socket closed");
            }
            return CompletableFuture.completedFuture("recovered");
        };

        // when
        RetryResult<String> result = retryExecutor.execute(KEY, operation, policy).join();

        // then
        assertThat(result.value()).isEqualTo("recovered");
        assertThat(result.history().get(0).errorKind()).isEqualTo(ErrorKind.NETWORK);
    }

    @Test
    void null_stage_반환_시_SystemException() {
        // given
        Operation<String> operation = () -> null;

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, policy);

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(SystemException.class);
    }

    @Test
    void RateLimit_오류는_retryAfter_힌트만큼_대기() {
        // given
        Operation<String> operation = failingTimes(
            1, () -> new RateLimitedException("slow down", Duration.ofSeconds(5)), "done"
        );

        // when
        retryExecutor.execute(KEY, operation, policy).join();

        // then
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        verify(rateLimitTracker, never()).update(any());
    }

    @Test
    void RateLimit_오류의_쿼터_정보는_Tracker에_반영() {
        // given
        RateLimitInfo info = new RateLimitInfo(KEY, 0, 100, NOW.plusSeconds(3), null);
        Operation<String> operation = failingTimes(
            1, () -> new RateLimitedException("quota", null, info), "done"
        );

        // when
        retryExecutor.execute(KEY, operation, policy).join();

        // then
        verify(rateLimitTracker, times(1)).update(info);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void 시도별_timeout_초과_시_TIMEOUT으로_분류() {
        // given
        CompletableFuture<String> never = new CompletableFuture<>();
        Operation<String> operation = () -> never;
        RetryPolicy shortTimeout = policy.withMaxRetries(0).withAttemptTimeout(Duration.ofMillis(50));

        // when
        CompletableFuture<String> future = retryExecutor.executeWithRetry(KEY, operation, shortTimeout);

        // then
        Throwable failure = DefaultErrorClassifier.unwrap(catchFailure(future));
        assertThat(failure).isInstanceOf(RetriesExhaustedException.class);
        assertThat(((RetriesExhaustedException) failure).kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(failure.getCause()).isInstanceOf(NetworkException.class);
        assertThat(never).isCancelled();
    }

    @Test
    void 취소_시_대기중인_sleep_취소와_다음_시도_중단() {
        // given
        CompletableFuture<Void> pendingSleep = new CompletableFuture<>();
        RetryExecutor blocking = new RetryExecutor(
            Clock.fixed(NOW, ZoneOffset.UTC),
            duration -> pendingSleep,
            DefaultErrorClassifier.INSTANCE,
            rateLimitTracker,
            listener,
            () -> 0.0
        );
        AtomicInteger calls = new AtomicInteger();
        Operation<String> operation = () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new NetworkException("down"));
        };

        // when
        CompletableFuture<String> future = blocking.executeWithRetry(KEY, operation, policy);
        future.cancel(true);

        // then
        assertThat(pendingSleep).isCancelled();
        assertThat(calls).hasValue(1);
    }

    private static Operation<String> failingTimes(
        int failures,
        java.util.function.Supplier<? extends Exception> error,
        String value
    ) {
        AtomicInteger calls = new AtomicInteger();
        return () -> {
            if (calls.incrementAndGet() <= failures) {
                return CompletableFuture.failedFuture(error.get());
            }
            return CompletableFuture.completedFuture(value);
        };
    }

    private static Throwable catchFailure(CompletableFuture<?> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            return e;
        }
        throw new AssertionError("Expected failure but future completed normally");
    }
}
