package com.ryuqq.resilience.core.protection;

import java.time.Duration;

/**
 * 응답 캐시 설정.
 *
 * @param defaultTtl 요청에 TTL이 지정되지 않았을 때 사용할 TTL (기본 30분)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheConfig(Duration defaultTtl) {

    /**
     * 기본 설정 생성자 (defaultTtl=30min).
     */
    public CacheConfig() {
        this(Duration.ofMinutes(30));
    }

    public CacheConfig {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive (current: " + defaultTtl + ")");
        }
    }
}
