package com.ryuqq.resilience.core.error;

/**
 * 잘못된 입력 오류.
 *
 * <p>재시도, Circuit Breaker 집계, Fallback 모두 적용되지 않고 즉시 호출자에게 전달됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ValidationException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
