package com.ryuqq.resilience.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 전이 실패 횟수 임계값 (기본 5)
 * @param openTimeout OPEN 유지 시간 (기본 60초)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, Duration openTimeout) {

    /**
     * 기본 설정 생성자 (failureThreshold=5, openTimeout=60s).
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException failureThreshold가 양수가 아니거나 openTimeout이 양수가 아닌 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException("openTimeout must be positive (current: " + openTimeout + ")");
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }

    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }
}
