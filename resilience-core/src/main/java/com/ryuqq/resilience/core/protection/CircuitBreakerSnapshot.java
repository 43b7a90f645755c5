package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Circuit Breaker 상태 스냅샷 (모니터링용, 읽기 전용).
 *
 * @param key 의존성 키
 * @param state 현재 상태
 * @param failureCount 마지막 reset 이후 누적 실패 횟수
 * @param lastFailureTime 마지막 실패 시각 (실패 이력이 없으면 null)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    DependencyKey key,
    CircuitBreakerState state,
    int failureCount,
    Instant lastFailureTime
) {

    public CircuitBreakerSnapshot {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be non-negative (current: " + failureCount + ")");
        }
    }

    /**
     * 실패 이력이 없는 CLOSED 스냅샷.
     *
     * @param key 의존성 키
     * @return CircuitBreakerSnapshot
     */
    public static CircuitBreakerSnapshot closed(DependencyKey key) {
        return new CircuitBreakerSnapshot(key, CircuitBreakerState.CLOSED, 0, null);
    }

    public Optional<Instant> lastFailure() {
        return Optional.ofNullable(lastFailureTime);
    }
}
