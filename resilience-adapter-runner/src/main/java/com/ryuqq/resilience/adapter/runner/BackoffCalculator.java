package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘 (failedAttempt = n, 1부터):</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(n-1), maxDelay)
 * jitter      = exponential * jitterFactor * random[0, 1)
 * delay       = min(exponential + jitter, maxDelay)
 * </pre>
 *
 * <p><strong>Rate Limit 오류:</strong></p>
 * <pre>
 * delay = min(retryAfter, maxDelay)                          (대기 힌트가 있는 경우)
 * delay = min(baseDelay * rateLimitMultiplier^n, maxDelay)   (힌트가 없는 경우)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>n=1: 1000ms + jitter(0-100ms) = 1000-1100ms</li>
 *   <li>n=2: 2000ms + jitter(0-200ms) = 2000-2200ms</li>
 *   <li>n=3: 4000ms + jitter(0-400ms) = 4000-4400ms</li>
 *   <li>n=7: 64000ms → maxDelay=60000ms로 제한</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final double rateLimitMultiplier;
    private final DoubleSupplier random;

    /**
     * 재시도 정책으로 생성.
     *
     * @param policy 재시도 정책
     */
    public BackoffCalculator(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param policy 재시도 정책
     * @param random [0, 1) 범위 난수 공급자
     */
    public BackoffCalculator(RetryPolicy policy, DoubleSupplier random) {
        Objects.requireNonNull(policy, "policy cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.baseDelayMs = policy.baseDelay().toMillis();
        this.maxDelayMs = policy.maxDelay().toMillis();
        this.jitterFactor = policy.jitterFactor();
        this.rateLimitMultiplier = policy.rateLimitMultiplier();
    }

    /**
     * 일반 오류 재시도 지연 시간 계산.
     *
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public Duration calculate(int failedAttempt) {
        requirePositive(failedAttempt);

        // 1. 지수적 백오프 (overflow 방지)
        long exponential = exponential(failedAttempt);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * nextRandom());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    /**
     * Rate Limit 오류 재시도 지연 시간 계산.
     *
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @param retryAfter 상위 서비스의 대기 힌트 (null 허용)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public Duration calculateRateLimit(int failedAttempt, Duration retryAfter) {
        requirePositive(failedAttempt);
        if (retryAfter != null) {
            return Duration.ofMillis(Math.min(Math.max(retryAfter.toMillis(), 0), maxDelayMs));
        }
        double delay = baseDelayMs * Math.pow(rateLimitMultiplier, failedAttempt);
        return Duration.ofMillis((long) Math.min(delay, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    private long exponential(int failedAttempt) {
        int shift = failedAttempt - 1;
        if (shift >= 62 || baseDelayMs > (maxDelayMs >> shift)) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << shift, maxDelayMs);
    }

    private double nextRandom() {
        double value = random.getAsDouble();
        if (value < 0.0 || value >= 1.0) {
            throw new IllegalStateException("random must be in [0, 1) (current: " + value + ")");
        }
        return value;
    }

    private static void requirePositive(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }
    }
}
