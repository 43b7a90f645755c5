package com.ryuqq.resilience.core.protection;

/**
 * 응답 캐시 통계.
 *
 * @param hits 히트 횟수
 * @param misses 미스 횟수 (만료 포함)
 * @param size 저장된 유효 항목 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheStats(long hits, long misses, int size) {

    public CacheStats {
        if (hits < 0 || misses < 0 || size < 0) {
            throw new IllegalArgumentException(
                "stats must be non-negative (hits: " + hits + ", misses: " + misses + ", size: " + size + ")"
            );
        }
    }

    /**
     * 히트율.
     *
     * @return 0.0 ~ 1.0 (조회 이력이 없으면 0.0)
     */
    public double hitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
