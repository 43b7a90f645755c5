/**
 * Runner Adapter Layer - Resilient Call 실행기 구현체.
 *
 * <p>이 패키지는 CallOrchestrator 인터페이스의 구체적인 구현체와 실행 구성요소를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.ResilientCallExecutor} - 캐시/Circuit/Rate Limit/재시도/Fallback 조합 실행기</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.RetryExecutor} - 분류 기반 재시도 루프</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.BackoffCalculator} - 지수 백오프 + jitter 계산</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.ResilienceRegistry} - 공유 보호 상태 레지스트리</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.AsyncEventPublisher} - Fire-and-forget 이벤트 발행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ResilientCallExecutor, RetryExecutor)
 *   ↓ implements
 * application (CallOrchestrator interface)
 *   ↓ depends on
 * core (DependencyKey, RetryPolicy, ErrorKind, FallbackPolicy)
 *   ↓ depends on
 * core/protection (CircuitBreaker, RateLimitTracker, ResponseCache SPI)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
