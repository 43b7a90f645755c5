/**
 * 오류 분류 체계.
 *
 * <p>{@link com.ryuqq.resilience.core.error.ErrorKind}가 재시도/Circuit Breaker/Fallback 분기의 유일한 기준입니다.
 * 모든 예외는 unchecked이며 {@link com.ryuqq.resilience.core.error.ResilienceException}을 루트로 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.error;
