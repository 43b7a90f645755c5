package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.CallAttemptResult;

import java.util.List;

/**
 * 재시도 루프의 성공 결과.
 *
 * @param value operation 결과
 * @param attempts 수행한 시도 횟수 (1 이상)
 * @param history 시도 이력 (마지막 항목이 성공)
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryResult<T>(T value, int attempts, List<CallAttemptResult> history) {

    public RetryResult {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        history = List.copyOf(history);
    }
}
