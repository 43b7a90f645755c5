package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (실패 횟수 &gt;= 임계값)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과 후 첫 isOpen 조회)
 * HALF_OPEN (시험 호출 1회 허용)
 *   │
 *   ├─► 성공 (reset) → CLOSED
 *   └─► 실패 → OPEN (타임스탬프 갱신)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 실패 횟수 집계).
     */
    CLOSED,

    /**
     * 차단 상태.
     *
     * <p>openTimeout 동안 모든 호출이 실제 operation 실행 없이 short circuit 됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>복구 여부를 확인하기 위한 시험 호출 1회만 통과시킵니다.</p>
     */
    HALF_OPEN
}
