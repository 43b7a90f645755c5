package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 재시도 예약 이벤트.
 *
 * @param dependencyKey 의존성 키
 * @param failedAttempt 실패한 시도 번호 (1부터)
 * @param errorKind 실패 분류
 * @param delay 다음 시도까지 대기 시간
 * @param timestamp 예약 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryScheduled(
    DependencyKey dependencyKey,
    int failedAttempt,
    ErrorKind errorKind,
    Duration delay,
    Instant timestamp
) implements ResilienceEvent {

    public RetryScheduled {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(errorKind, "errorKind cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be positive (current: " + failedAttempt + ")");
        }
    }
}
