package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Instant;
import java.util.Objects;

/**
 * 캐시 미스 이벤트 (만료 포함).
 *
 * @param dependencyKey 의존성 키
 * @param cacheKey 캐시 키
 * @param timestamp 조회 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheMiss(DependencyKey dependencyKey, String cacheKey, Instant timestamp) implements ResilienceEvent {

    public CacheMiss {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(cacheKey, "cacheKey cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
