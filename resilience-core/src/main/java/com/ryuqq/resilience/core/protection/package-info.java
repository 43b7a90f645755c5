/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 의존성 호출의 장애를 격리하기 위한 세 가지 레지스트리 확장점을 정의합니다.
 * 모든 상태는 {@link com.ryuqq.resilience.core.model.DependencyKey} (캐시는 캐시 키) 단위로 관리됩니다.</p>
 *
 * <h2>호출 경로 순서</h2>
 *
 * <pre>
 * 1. ResponseCache     → 캐시 히트 시 즉시 반환
 * 2. CircuitBreaker    → OPEN 상태 시 operation 없이 Fallback
 * 3. RateLimitTracker  → 쿼터 소진 시 resetTime까지 대기
 * 4. RetryExecutor     → 분류 기반 재시도 + 백오프
 * 5. Fallback          → 재시도 소진 / short circuit 시 대체 결과
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>모든 Protection SPI는 {@code noop} 하위 패키지에 NoOp 기본 구현을 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.RateLimitTracker
 * @see com.ryuqq.resilience.core.protection.ResponseCache
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
