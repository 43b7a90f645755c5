package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.time.Instant;
import java.util.Objects;

/**
 * Circuit Breaker 상태 전이 이벤트.
 *
 * @param dependencyKey 의존성 키
 * @param from 이전 상태
 * @param to 새 상태
 * @param failureCount 전이 시점의 실패 횟수
 * @param timestamp 전이 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitStateChanged(
    DependencyKey dependencyKey,
    CircuitBreakerState from,
    CircuitBreakerState to,
    int failureCount,
    Instant timestamp
) implements ResilienceEvent {

    public CircuitStateChanged {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        if (from == to) {
            throw new IllegalArgumentException("from and to must differ (current: " + from + ")");
        }
    }
}
