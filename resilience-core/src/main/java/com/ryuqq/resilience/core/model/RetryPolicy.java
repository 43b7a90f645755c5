package com.ryuqq.resilience.core.model;

import java.time.Duration;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3, 총 시도 횟수는 maxRetries + 1)</li>
 *   <li>baseDelay: 기본 지연 시간 (기본 1초)</li>
 *   <li>maxDelay: 최대 지연 시간 (기본 60초)</li>
 *   <li>attemptTimeout: 시도당 타임아웃 (기본 30초)</li>
 *   <li>rateLimitMultiplier: Rate Limit 오류 시 백오프 배수 (기본 2.0)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelay 기본 지연 시간 (양수)
 * @param maxDelay 최대 지연 시간 (baseDelay 이상)
 * @param attemptTimeout 시도당 타임아웃 (양수)
 * @param rateLimitMultiplier Rate Limit 백오프 배수 (1.0 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    Duration attemptTimeout,
    double rateLimitMultiplier,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, baseDelay=1s, maxDelay=60s, attemptTimeout=30s,
     * rateLimitMultiplier=2.0, jitterFactor=0.1</p>
     */
    public RetryPolicy() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60), Duration.ofSeconds(30), 2.0, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive (current: " + attemptTimeout + ")");
        }
        if (rateLimitMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "rateLimitMultiplier must be >= 1.0 (current: " + rateLimitMultiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 총 시도 가능 횟수.
     *
     * @return maxRetries + 1
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }

    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }

    public RetryPolicy withAttemptTimeout(Duration attemptTimeout) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }

    public RetryPolicy withRateLimitMultiplier(double rateLimitMultiplier) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, attemptTimeout, rateLimitMultiplier, jitterFactor);
    }
}
