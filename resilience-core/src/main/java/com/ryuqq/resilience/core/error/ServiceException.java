package com.ryuqq.resilience.core.error;

import java.util.Objects;

/**
 * 상위 서비스 오류.
 *
 * <p>두 가지 용도로 사용됩니다:</p>
 * <ul>
 *   <li>operation 내부: 상위 서버가 5xx 등을 반환한 경우 (attempts = 0)</li>
 *   <li>실행기 결과: 재시도 소진 또는 Circuit Open 상태에서 Fallback이 없는 경우.
 *       dependencyKey, attempts, lastStatus를 포함하며 retryable = true</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ServiceException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final String dependencyKey;
    private final int attempts;
    private final Integer lastStatus;
    private final boolean retryable;

    /**
     * operation 내부에서 상위 서버 오류를 알리기 위한 생성자.
     *
     * @param message 메시지
     * @param status HTTP 상태 코드 (null 허용)
     */
    public ServiceException(String message, Integer status) {
        this(message, null, 0, status, true, null);
    }

    /**
     * 전체 생성자.
     *
     * @param message 메시지
     * @param dependencyKey 의존성 키 (null 허용)
     * @param attempts 수행한 시도 횟수 (0 이상)
     * @param lastStatus 마지막 HTTP 상태 코드 (null 허용)
     * @param retryable 호출자가 나중에 다시 시도해도 되는지 여부
     * @param cause 원인 (null 허용)
     */
    public ServiceException(
        String message,
        String dependencyKey,
        int attempts,
        Integer lastStatus,
        boolean retryable,
        Throwable cause
    ) {
        super(message, cause);
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        this.dependencyKey = dependencyKey;
        this.attempts = attempts;
        this.lastStatus = lastStatus;
        this.retryable = retryable;
    }

    /**
     * 재시도 소진 / Circuit Open으로 호출이 불가능함을 나타내는 예외 생성.
     *
     * @param dependencyKey 의존성 키
     * @param attempts 수행한 시도 횟수 (short circuit이면 0)
     * @param lastStatus 마지막 HTTP 상태 코드 (null 허용)
     * @param cause 원인 (null 허용)
     * @return ServiceException (retryable = true)
     */
    public static ServiceException unavailable(String dependencyKey, int attempts, Integer lastStatus, Throwable cause) {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        String message = "Dependency temporarily unavailable: " + dependencyKey
            + " (attempts: " + attempts + ", lastStatus: " + lastStatus + ")";
        return new ServiceException(message, dependencyKey, attempts, lastStatus, true, cause);
    }

    public String getDependencyKey() {
        return dependencyKey;
    }

    public int getAttempts() {
        return attempts;
    }

    public Integer getLastStatus() {
        return lastStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERVICE;
    }
}
