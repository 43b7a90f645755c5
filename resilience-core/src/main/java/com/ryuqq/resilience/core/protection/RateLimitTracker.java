package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 의존성 키 단위 Rate Limit 추적 SPI.
 *
 * <p>상위 응답의 쿼터/리셋 힌트를 기록하고, 쿼터가 소진된 의존성 호출을
 * 리셋 시각까지 선제적으로 지연시킵니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>만료된 항목은 다음 조회 시 지연 정리 (백그라운드 정리 없음)</li>
 *   <li>키의 resetTime은 항목이 정리되기 전까지 감소하지 않음</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RateLimitTracker {

    /**
     * 응답 메타데이터 기록.
     *
     * @param key 의존성 키
     * @param remainingRequests 남은 요청 수
     * @param remainingTokens 남은 토큰 수
     * @param resetTime 쿼터 회복 시각
     * @param retryAfter 대기 힌트 (null 허용)
     */
    default void updateFromResponse(
        DependencyKey key,
        long remainingRequests,
        long remainingTokens,
        Instant resetTime,
        Duration retryAfter
    ) {
        update(new RateLimitInfo(key, remainingRequests, remainingTokens, resetTime, retryAfter));
    }

    /**
     * 파싱된 Rate Limit 정보 기록.
     *
     * @param info Rate Limit 정보
     */
    void update(RateLimitInfo info);

    /**
     * 필요 시 대기.
     *
     * <ul>
     *   <li>항목 없음: 즉시 완료</li>
     *   <li>resetTime 경과: 항목 정리 후 즉시 완료</li>
     *   <li>쿼터 소진 + resetTime 전: resetTime까지 대기 후 항목 정리</li>
     *   <li>쿼터 남음: 즉시 완료</li>
     * </ul>
     *
     * <p>반환된 Future를 취소하면 대기도 취소되며 항목은 정리되지 않습니다.</p>
     *
     * @param key 의존성 키
     * @return 대기 완료 시 완료되는 Future
     */
    CompletableFuture<Void> waitIfNeeded(DependencyKey key);

    /**
     * 키별 Rate Limit 정보 조회 (정리를 일으키지 않음).
     *
     * @param key 의존성 키
     * @return Rate Limit 정보
     */
    Optional<RateLimitInfo> status(DependencyKey key);

    /**
     * 전체 Rate Limit 정보 조회.
     *
     * @return 키별 정보 (불변)
     */
    Map<DependencyKey, RateLimitInfo> statuses();

    /**
     * 키의 Rate Limit 정보 제거.
     *
     * @param key 의존성 키
     */
    void clear(DependencyKey key);
}
