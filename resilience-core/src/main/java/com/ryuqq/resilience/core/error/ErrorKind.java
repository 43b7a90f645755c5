package com.ryuqq.resilience.core.error;

/**
 * 오류 분류 (Tagged Discriminator).
 *
 * <p>재시도 실행기는 예외 메시지나 클래스 계층이 아닌 이 분류를 기준으로 분기합니다.</p>
 *
 * <p><strong>분류별 처리:</strong></p>
 * <ul>
 *   <li>VALIDATION: 잘못된 입력. 재시도/Circuit Breaker/Fallback 모두 우회</li>
 *   <li>NETWORK: 연결 실패. 재시도 가능</li>
 *   <li>TIMEOUT: 시도 타임아웃 (NETWORK 변형). 재시도 가능</li>
 *   <li>SERVICE: 상위 서버 오류. 재시도 가능</li>
 *   <li>RATE_LIMIT: Rate Limit 응답 (SERVICE 변형, 대기 힌트 포함 가능). 재시도 가능</li>
 *   <li>SYSTEM: 예상치 못한 내부 오류. 재시도하지 않음 (critical)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum ErrorKind {

    VALIDATION(false),
    NETWORK(true),
    TIMEOUT(true),
    SERVICE(true),
    RATE_LIMIT(true),
    SYSTEM(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 재시도 가능 여부.
     *
     * @return NETWORK, TIMEOUT, SERVICE, RATE_LIMIT이면 true
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Circuit Breaker 실패 집계 및 Fallback 대상 여부.
     *
     * <p>재시도 가능한 분류만 의존성 장애로 간주합니다.</p>
     *
     * @return 의존성 장애이면 true
     */
    public boolean isDependencyFailure() {
        return retryable;
    }
}
