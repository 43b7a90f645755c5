package com.ryuqq.resilience.core.error;

/**
 * Resilience 계층 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorKind}를 가지며, 재시도 여부는 이 값으로 결정됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류 분류.
     *
     * @return ErrorKind
     */
    public abstract ErrorKind kind();
}
