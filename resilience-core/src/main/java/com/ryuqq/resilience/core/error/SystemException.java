package com.ryuqq.resilience.core.error;

/**
 * 예상치 못한 내부 오류 (critical).
 *
 * <p>재시도하지 않고, Circuit Breaker에 집계하지 않으며, Fallback으로 대체하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class SystemException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    public SystemException(String message) {
        super(message);
    }

    public SystemException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SYSTEM;
    }
}
