package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.error.ErrorKind;

/**
 * 재시도 루프 내 단일 시도의 결과.
 *
 * <p>하나의 재시도 루프 안에서만 사용되는 일회성 값이며,
 * 재시도 소진 시 예외에 이력으로 첨부되어 진단에 활용됩니다.</p>
 *
 * @param success 시도 성공 여부
 * @param errorKind 실패 분류 (성공 시 null)
 * @param attemptNumber 시도 번호 (1부터 시작)
 * @param delayMs 이 시도 이후 다음 시도까지 대기한 시간 (밀리초, 재시도하지 않으면 0)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CallAttemptResult(
    boolean success,
    ErrorKind errorKind,
    int attemptNumber,
    long delayMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public CallAttemptResult {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        if (success && errorKind != null) {
            throw new IllegalArgumentException("errorKind must be null for a successful attempt");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null for a failed attempt");
        }
    }

    /**
     * 성공한 시도.
     *
     * @param attemptNumber 시도 번호
     * @return CallAttemptResult
     */
    public static CallAttemptResult succeeded(int attemptNumber) {
        return new CallAttemptResult(true, null, attemptNumber, 0);
    }

    /**
     * 실패한 시도.
     *
     * @param errorKind 실패 분류
     * @param attemptNumber 시도 번호
     * @param delayMs 다음 시도까지 대기 시간 (밀리초)
     * @return CallAttemptResult
     */
    public static CallAttemptResult failed(ErrorKind errorKind, int attemptNumber, long delayMs) {
        return new CallAttemptResult(false, errorKind, attemptNumber, delayMs);
    }
}
