package com.ryuqq.resilience.core.error;

import java.util.Set;

/**
 * HTTP 상태 코드 분류.
 *
 * <p>operation 구현체가 상위 응답 코드를 예외로 변환할 때 사용합니다.</p>
 *
 * <ul>
 *   <li>408: TIMEOUT</li>
 *   <li>429: RATE_LIMIT</li>
 *   <li>그 외 4xx: VALIDATION</li>
 *   <li>5xx: SERVICE</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class HttpStatusClassification {

    /**
     * 재시도 대상 상태 코드 (Cloudflare 52x 포함).
     */
    public static final Set<Integer> RETRYABLE_STATUS_CODES =
        Set.of(408, 429, 500, 502, 503, 504, 520, 521, 522, 524);

    private HttpStatusClassification() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 코드 분류.
     *
     * @param status HTTP 상태 코드 (400 ~ 599)
     * @return ErrorKind
     * @throws IllegalArgumentException 오류 상태 코드가 아닌 경우
     */
    public static ErrorKind classify(int status) {
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("status must be an error status code (current: " + status + ")");
        }
        if (status == 408) {
            return ErrorKind.TIMEOUT;
        }
        if (status == 429) {
            return ErrorKind.RATE_LIMIT;
        }
        if (status < 500) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.SERVICE;
    }

    /**
     * 재시도 대상 상태 코드 여부.
     *
     * @param status HTTP 상태 코드
     * @return 재시도 대상이면 true
     */
    public static boolean isRetryable(int status) {
        return RETRYABLE_STATUS_CODES.contains(status);
    }

    /**
     * 상태 코드에 맞는 예외 생성.
     *
     * @param status HTTP 상태 코드 (400 ~ 599)
     * @param message 메시지
     * @return 분류에 맞는 ResilienceException
     */
    public static ResilienceException toException(int status, String message) {
        ErrorKind kind = classify(status);
        switch (kind) {
            case TIMEOUT:
                return NetworkException.timeout(message + " (status: " + status + ")", null);
            case RATE_LIMIT:
                return new RateLimitedException(message);
            case VALIDATION:
                return new ValidationException(message + " (status: " + status + ")");
            default:
                return new ServiceException(message, status);
        }
    }
}
