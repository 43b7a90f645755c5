package com.ryuqq.resilience.core.protection;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL 기반 응답 캐시 SPI.
 *
 * <p>성공한 호출 결과를 짧은 기간 보관합니다. 키 정규화는 호출자의 책임이며
 * {@link com.ryuqq.resilience.core.model.CacheKeys}를 사용할 수 있습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@code expiry > now}인 항목만 반환</li>
 *   <li>만료 항목은 조회 시 지연 정리 (백그라운드 정리 없음)</li>
 *   <li>저장 시 expiry는 항상 미래 (TTL 양수)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResponseCache {

    /**
     * 캐시 조회.
     *
     * @param key 캐시 키
     * @return 유효한 값 (만료되었거나 없으면 empty)
     */
    Optional<Object> get(String key);

    /**
     * 캐시 저장 (기존 항목 덮어쓰기).
     *
     * @param key 캐시 키
     * @param data 값 (null 불가)
     * @param ttl 유효 기간 (양수)
     * @throws IllegalArgumentException ttl이 양수가 아니거나 data가 null인 경우
     */
    void set(String key, Object data, Duration ttl);

    /**
     * 캐시 항목 제거.
     *
     * @param key 캐시 키
     * @return 제거된 항목이 있으면 true
     */
    boolean invalidate(String key);

    /**
     * 접두사로 시작하는 캐시 항목 일괄 제거.
     *
     * @param prefix 키 접두사
     * @return 제거된 항목 수
     */
    int invalidateByPrefix(String prefix);

    /**
     * 유효 항목 수.
     *
     * @return 만료되지 않은 항목 수
     */
    int size();

    /**
     * 캐시 통계.
     *
     * @return CacheStats
     */
    CacheStats stats();
}
