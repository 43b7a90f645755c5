package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Instant;

/**
 * Resilience 계층에서 발생하는 구조화된 이벤트.
 *
 * <ul>
 *   <li>{@link CircuitStateChanged}: Circuit Breaker 상태 전이</li>
 *   <li>{@link RetryScheduled}: 재시도 예약</li>
 *   <li>{@link CacheHit}, {@link CacheMiss}: 캐시 조회 결과</li>
 *   <li>{@link RateLimitWait}: Rate Limit 대기 시작</li>
 *   <li>{@link FallbackUsed}: 대체 결과 사용</li>
 * </ul>
 *
 * <p>이벤트는 fire-and-forget으로 전달되며 호출 경로를 막지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public sealed interface ResilienceEvent
    permits CircuitStateChanged, RetryScheduled, CacheHit, CacheMiss, RateLimitWait, FallbackUsed {

    /**
     * 이벤트가 발생한 의존성 키.
     *
     * @return DependencyKey
     */
    DependencyKey dependencyKey();

    /**
     * 이벤트 발생 시각.
     *
     * @return Instant
     */
    Instant timestamp();
}
