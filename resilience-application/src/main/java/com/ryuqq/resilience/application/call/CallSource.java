package com.ryuqq.resilience.application.call;

/**
 * 호출 결과의 출처.
 *
 * <p>호출자는 이 값으로 실제 결과와 대체 결과를 구분합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CallSource {

    /**
     * operation 실행으로 얻은 실제 결과.
     */
    LIVE,

    /**
     * operation 실행 없이 응답 캐시에서 얻은 결과.
     */
    CACHED,

    /**
     * Fallback이 만든 대체 결과 (degraded).
     */
    FALLBACK
}
