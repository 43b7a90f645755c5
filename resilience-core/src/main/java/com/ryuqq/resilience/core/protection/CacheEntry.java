package com.ryuqq.resilience.core.protection;

import java.time.Instant;
import java.util.Objects;

/**
 * 응답 캐시 항목.
 *
 * @param key 캐시 키
 * @param data 캐시된 값 (null 불가)
 * @param expiry 만료 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheEntry(String key, Object data, Instant expiry) {

    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(expiry, "expiry cannot be null");
    }

    /**
     * 유효 여부.
     *
     * @param now 현재 시각
     * @return expiry &gt; now 이면 true
     */
    public boolean isLive(Instant now) {
        return expiry.isAfter(now);
    }
}
