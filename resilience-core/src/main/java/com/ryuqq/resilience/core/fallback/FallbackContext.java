package com.ryuqq.resilience.core.fallback;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fallback 호출 컨텍스트.
 *
 * @param dependencyKey 의존성 키
 * @param reason Fallback 사용 사유
 * @param attempts 수행한 시도 횟수 (short circuit이면 0)
 * @param lastError 마지막 오류 (short circuit이면 null)
 * @param attributes 호출자가 전달한 컨텍스트 (불변)
 * @author Resilience Team
 * @since 1.0.0
 */
public record FallbackContext(
    DependencyKey dependencyKey,
    FallbackReason reason,
    int attempts,
    Throwable lastError,
    Map<String, Object> attributes
) {

    public FallbackContext {
        Objects.requireNonNull(dependencyKey, "dependencyKey cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(lastError);
    }
}
