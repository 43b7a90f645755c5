package com.ryuqq.resilience.core.fallback;

/**
 * Fallback 사용 사유.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum FallbackReason {

    /**
     * Circuit Breaker가 OPEN 상태여서 operation을 실행하지 않음.
     */
    CIRCUIT_OPEN,

    /**
     * 재시도 가능한 오류로 모든 시도가 실패함.
     */
    RETRIES_EXHAUSTED
}
