/**
 * 도메인 값 타입 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.model.DependencyKey} - 외부 의존성 식별자</li>
 *   <li>{@link com.ryuqq.resilience.core.model.CacheKeys} - 캐시 키 정규화</li>
 *   <li>{@link com.ryuqq.resilience.core.model.CallAttemptResult} - 단일 시도 결과</li>
 *   <li>{@link com.ryuqq.resilience.core.model.RetryPolicy} - 재시도 정책</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
