package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;

import java.util.Objects;

/**
 * Resilience 실행 계층 통합 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>circuitBreaker: 실패 임계값 5, open timeout 60초</li>
 *   <li>retryPolicy: 요청에 정책이 없을 때 사용할 기본 재시도 정책 (최대 3회 재시도)</li>
 *   <li>cache: 기본 TTL 30분</li>
 *   <li>recordShortCircuitAsFailure: 차단된 호출도 실패로 기록할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>recordShortCircuitAsFailure 주의:</strong> true이면 차단된 호출마다 마지막 실패 시각이
 * 갱신되어 OPEN 구간이 연장됩니다. 따라서 openTimeout보다 짧은 간격으로 계속 호출되는 의존성은
 * HALF_OPEN에 도달하지 못하고 호출 빈도가 openTimeout 아래로 떨어질 때까지 OPEN에 머뭅니다.
 * 트래픽과 무관하게 openTimeout 후 시험 호출을 허용하려면 false로 설정합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param circuitBreaker Circuit Breaker 설정
 * @param retryPolicy 기본 재시도 정책
 * @param cache 캐시 설정
 * @param recordShortCircuitAsFailure 차단된 호출의 실패 기록 여부
 */
public record ResilienceConfig(
    CircuitBreakerConfig circuitBreaker,
    RetryPolicy retryPolicy,
    CacheConfig cache,
    boolean recordShortCircuitAsFailure
) {

    /**
     * 기본 설정 생성자.
     */
    public ResilienceConfig() {
        this(new CircuitBreakerConfig(), new RetryPolicy(), new CacheConfig(), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws NullPointerException 하위 설정이 null인 경우
     */
    public ResilienceConfig {
        Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        Objects.requireNonNull(cache, "cache cannot be null");
    }

    public ResilienceConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(circuitBreaker, retryPolicy, cache, recordShortCircuitAsFailure);
    }

    public ResilienceConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new ResilienceConfig(circuitBreaker, retryPolicy, cache, recordShortCircuitAsFailure);
    }

    public ResilienceConfig withCache(CacheConfig cache) {
        return new ResilienceConfig(circuitBreaker, retryPolicy, cache, recordShortCircuitAsFailure);
    }

    public ResilienceConfig withRecordShortCircuitAsFailure(boolean recordShortCircuitAsFailure) {
        return new ResilienceConfig(circuitBreaker, retryPolicy, cache, recordShortCircuitAsFailure);
    }
}
