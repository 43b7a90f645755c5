package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Rate Limit 대기 시작 이벤트.
 *
 * @param dependencyKey 의존성 키
 * @param waitTime 대기 시간
 * @param resetTime 쿼터 회복 시각
 * @param timestamp 대기 시작 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimitWait(
    DependencyKey dependencyKey,
    Duration waitTime,
    Instant resetTime,
    Instant timestamp
) implements ResilienceEvent {

    public RateLimitWait {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(waitTime, "waitTime cannot be null");
        Objects.requireNonNull(resetTime, "resetTime cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
