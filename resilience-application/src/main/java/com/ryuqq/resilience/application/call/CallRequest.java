package com.ryuqq.resilience.application.call;

import com.ryuqq.resilience.core.error.ValidationException;
import com.ryuqq.resilience.core.executor.Operation;
import com.ryuqq.resilience.core.fallback.FallbackPolicy;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resilient 호출 요청.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>dependencyKey (필수): Circuit Breaker / Rate Limit 상태의 단위</li>
 *   <li>operation (필수): 시도마다 다시 실행되는 외부 호출</li>
 *   <li>retryPolicy (선택): 없으면 실행기 기본 정책</li>
 *   <li>fallback (선택): 없으면 재시도 소진 시 {@code ServiceException}</li>
 *   <li>context (선택): Fallback에 전달되는 호출자 속성</li>
 *   <li>cacheKey, cacheTtl (선택): cacheKey가 있을 때만 캐시 조회/저장</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CallRequest<SearchResult> request = CallRequest.builder("serper", () -> client.search(query))
 *     .retryPolicy(new RetryPolicy().withMaxRetries(2))
 *     .fallback(FallbackPolicy.value(SearchResult.empty()))
 *     .cacheKey(CacheKeys.of("serper", "search", Map.of("q", query)))
 *     .build();
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CallRequest<T> {

    private final DependencyKey dependencyKey;
    private final Operation<T> operation;
    private final RetryPolicy retryPolicy;
    private final FallbackPolicy<T> fallback;
    private final Map<String, Object> context;
    private final String cacheKey;
    private final Duration cacheTtl;

    private CallRequest(Builder<T> builder) {
        this.dependencyKey = builder.dependencyKey;
        this.operation = builder.operation;
        this.retryPolicy = builder.retryPolicy;
        this.fallback = builder.fallback;
        this.context = Map.copyOf(builder.context);
        this.cacheKey = builder.cacheKey;
        this.cacheTtl = builder.cacheTtl;
    }

    /**
     * Builder 생성.
     *
     * @param dependencyKey 의존성 키 문자열
     * @param operation 외부 호출
     * @param <T> 결과 타입
     * @return Builder
     */
    public static <T> Builder<T> builder(String dependencyKey, Operation<T> operation) {
        return new Builder<>(dependencyKey, operation);
    }

    public DependencyKey getDependencyKey() {
        return dependencyKey;
    }

    public Operation<T> getOperation() {
        return operation;
    }

    public Optional<RetryPolicy> getRetryPolicy() {
        return Optional.ofNullable(retryPolicy);
    }

    public Optional<FallbackPolicy<T>> getFallback() {
        return Optional.ofNullable(fallback);
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Optional<String> getCacheKey() {
        return Optional.ofNullable(cacheKey);
    }

    public Optional<Duration> getCacheTtl() {
        return Optional.ofNullable(cacheTtl);
    }

    @Override
    public String toString() {
        return "CallRequest{dependencyKey=" + dependencyKey + ", cacheKey=" + cacheKey
            + ", fallback=" + (fallback != null) + "}";
    }

    /**
     * CallRequest Builder.
     *
     * <p>{@link #build()}에서 입력을 검증하며, 실패 시 {@link ValidationException}을 던집니다.</p>
     *
     * @param <T> 결과 타입
     */
    public static final class Builder<T> {

        private final String rawDependencyKey;
        private DependencyKey dependencyKey;
        private final Operation<T> operation;
        private RetryPolicy retryPolicy;
        private FallbackPolicy<T> fallback;
        private final Map<String, Object> context = new HashMap<>();
        private String cacheKey;
        private Duration cacheTtl;

        private Builder(String dependencyKey, Operation<T> operation) {
            this.rawDependencyKey = dependencyKey;
            this.operation = operation;
        }

        public Builder<T> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<T> fallback(FallbackPolicy<T> fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder<T> context(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new ValidationException("context name cannot be null or blank");
            }
            if (value == null) {
                throw new ValidationException("context value cannot be null (name: " + name + ")");
            }
            this.context.put(name, value);
            return this;
        }

        public Builder<T> context(Map<String, ?> context) {
            if (context != null) {
                context.forEach(this::context);
            }
            return this;
        }

        public Builder<T> cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder<T> cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /**
         * 요청 생성.
         *
         * @return CallRequest
         * @throws ValidationException 의존성 키, operation, 캐시 설정이 유효하지 않은 경우
         */
        public CallRequest<T> build() {
            try {
                this.dependencyKey = DependencyKey.of(rawDependencyKey);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid dependency key: " + e.getMessage(), e);
            }
            if (operation == null) {
                throw new ValidationException("operation cannot be null (dependencyKey: " + rawDependencyKey + ")");
            }
            if (cacheKey != null && cacheKey.isBlank()) {
                throw new ValidationException("cacheKey cannot be blank (dependencyKey: " + rawDependencyKey + ")");
            }
            if (cacheTtl != null && (cacheTtl.isNegative() || cacheTtl.isZero())) {
                throw new ValidationException("cacheTtl must be positive (current: " + cacheTtl + ")");
            }
            return new CallRequest<>(this);
        }
    }
}
