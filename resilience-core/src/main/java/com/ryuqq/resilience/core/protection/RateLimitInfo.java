package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 상위 응답에서 얻은 Rate Limit 쿼터 정보.
 *
 * <p>남은 요청/토큰 수를 알 수 없는 경우 {@link #UNKNOWN}을 사용합니다.</p>
 *
 * @param key 의존성 키
 * @param requestsRemaining 남은 요청 수
 * @param tokensRemaining 남은 토큰 수
 * @param resetTime 쿼터 회복 시각
 * @param retryAfter 상위 서비스의 명시적 대기 힌트 (null 허용)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimitInfo(
    DependencyKey key,
    long requestsRemaining,
    long tokensRemaining,
    Instant resetTime,
    Duration retryAfter
) {

    /**
     * 남은 수량을 알 수 없음.
     */
    public static final long UNKNOWN = Long.MAX_VALUE;

    public RateLimitInfo {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(resetTime, "resetTime cannot be null");
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be non-negative (current: " + retryAfter + ")");
        }
    }

    /**
     * 쿼터 소진 여부.
     *
     * @return 남은 요청 수 또는 남은 토큰 수가 0 이하이면 true
     */
    public boolean isExhausted() {
        return requestsRemaining <= 0 || tokensRemaining <= 0;
    }

    /**
     * resetTime 경과 여부.
     *
     * @param now 현재 시각
     * @return now &gt;= resetTime 이면 true
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(resetTime);
    }

    /**
     * 호출 전 대기해야 하는 시간.
     *
     * @param now 현재 시각
     * @return 쿼터 소진 상태이고 resetTime 전이면 남은 시간, 아니면 {@link Duration#ZERO}
     */
    public Duration waitTime(Instant now) {
        if (!isExhausted() || isExpired(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, resetTime);
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * 동일 키의 새 정보로 갱신 (resetTime 비감소 유지).
     *
     * <p>남은 수량과 retryAfter는 새 값으로 덮어쓰고, resetTime은 둘 중 늦은 값을 유지합니다.</p>
     *
     * @param newer 새 정보
     * @return 병합된 정보
     */
    public RateLimitInfo mergeWith(RateLimitInfo newer) {
        if (!key.equals(newer.key)) {
            throw new IllegalArgumentException("Cannot merge rate limit info of different keys: " + key + ", " + newer.key);
        }
        Instant reset = newer.resetTime.isAfter(resetTime) ? newer.resetTime : resetTime;
        return new RateLimitInfo(key, newer.requestsRemaining, newer.tokensRemaining, reset, newer.retryAfter);
    }
}
