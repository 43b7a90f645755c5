package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.protection.RateLimitInfo;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate Limit 응답 오류 (SERVICE 변형).
 *
 * <p>상위 서비스가 명시한 대기 힌트(retryAfter)와 쿼터 정보를 선택적으로 포함합니다.
 * 실행기는 쿼터 정보가 있으면 {@code RateLimitTracker}에 자동으로 반영합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RateLimitedException extends ServiceException {

    private static final long serialVersionUID = 1L;

    private static final int TOO_MANY_REQUESTS = 429;

    private final transient Duration retryAfter;
    private final transient RateLimitInfo rateLimitInfo;

    public RateLimitedException(String message) {
        this(message, null, null);
    }

    public RateLimitedException(String message, Duration retryAfter) {
        this(message, retryAfter, null);
    }

    /**
     * 전체 생성자.
     *
     * @param message 메시지
     * @param retryAfter 대기 힌트 (null 허용, 음수 불가)
     * @param rateLimitInfo 응답에서 파싱한 쿼터 정보 (null 허용)
     */
    public RateLimitedException(String message, Duration retryAfter, RateLimitInfo rateLimitInfo) {
        super(message, TOO_MANY_REQUESTS);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be non-negative (current: " + retryAfter + ")");
        }
        Duration hint = retryAfter;
        if (hint == null && rateLimitInfo != null) {
            hint = rateLimitInfo.retryAfter();
        }
        this.retryAfter = hint;
        this.rateLimitInfo = rateLimitInfo;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public Optional<RateLimitInfo> getRateLimitInfo() {
        return Optional.ofNullable(rateLimitInfo);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMIT;
    }
}
