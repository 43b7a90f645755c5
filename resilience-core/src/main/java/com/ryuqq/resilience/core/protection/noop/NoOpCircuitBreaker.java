package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;

import java.util.Map;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>isOpen(): 항상 false 반환</li>
 *   <li>recordFailure(), reset(): 아무 동작 안 함</li>
 *   <li>snapshot(): 항상 CLOSED 스냅샷 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public boolean isOpen(DependencyKey key) {
        return false;
    }

    @Override
    public void recordFailure(DependencyKey key) {
        // NoOp
    }

    @Override
    public void reset(DependencyKey key) {
        // NoOp
    }

    @Override
    public CircuitBreakerSnapshot snapshot(DependencyKey key) {
        return CircuitBreakerSnapshot.closed(key);
    }

    @Override
    public Map<DependencyKey, CircuitBreakerSnapshot> snapshots() {
        return Map.of();
    }
}
