package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.fallback.FallbackReason;
import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Instant;
import java.util.Objects;

/**
 * 대체 결과 사용 이벤트.
 *
 * @param dependencyKey 의존성 키
 * @param reason Fallback 사유
 * @param attempts 수행한 시도 횟수
 * @param timestamp 발생 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record FallbackUsed(
    DependencyKey dependencyKey,
    FallbackReason reason,
    int attempts,
    Instant timestamp
) implements ResilienceEvent {

    public FallbackUsed {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }
}
