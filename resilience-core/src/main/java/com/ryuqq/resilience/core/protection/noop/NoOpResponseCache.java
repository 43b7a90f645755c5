package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.CacheStats;
import com.ryuqq.resilience.core.protection.ResponseCache;

import java.time.Duration;
import java.util.Optional;

/**
 * Response Cache NoOp 구현.
 *
 * <p>아무것도 저장하지 않으며 항상 미스를 반환합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpResponseCache implements ResponseCache {

    @Override
    public Optional<Object> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object data, Duration ttl) {
        // NoOp
    }

    @Override
    public boolean invalidate(String key) {
        return false;
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        return 0;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(0, 0, 0);
    }
}
