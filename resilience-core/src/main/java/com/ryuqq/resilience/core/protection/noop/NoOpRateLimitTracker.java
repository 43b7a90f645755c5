package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.protection.RateLimitInfo;
import com.ryuqq.resilience.core.protection.RateLimitTracker;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Rate Limit Tracker NoOp 구현.
 *
 * <p>정보를 기록하지 않으며 대기하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpRateLimitTracker implements RateLimitTracker {

    @Override
    public void update(RateLimitInfo info) {
        // NoOp
    }

    @Override
    public CompletableFuture<Void> waitIfNeeded(DependencyKey key) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Optional<RateLimitInfo> status(DependencyKey key) {
        return Optional.empty();
    }

    @Override
    public Map<DependencyKey, RateLimitInfo> statuses() {
        return Map.of();
    }

    @Override
    public void clear(DependencyKey key) {
        // NoOp
    }
}
