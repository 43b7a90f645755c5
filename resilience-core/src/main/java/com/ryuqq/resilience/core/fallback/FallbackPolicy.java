package com.ryuqq.resilience.core.fallback;

import com.ryuqq.resilience.core.error.DefaultErrorClassifier;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 대체 결과 공급자.
 *
 * <p>재시도 소진 또는 Circuit Open 시 호출되며, 반환한 값은 호출자에게
 * {@code FALLBACK} 출처로 표시되어 전달됩니다 (실제 결과와 구분 가능).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FallbackPolicy<List<Result>> fallback = FallbackPolicy.<List<Result>>supplier(staleResults::get)
 *     .orElse(FallbackPolicy.value(List.of()));
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallbackPolicy<T> {

    /**
     * 대체 결과 생성.
     *
     * @param context Fallback 컨텍스트
     * @return 대체 결과 Stage
     */
    CompletionStage<T> recover(FallbackContext context);

    /**
     * 현재 Fallback이 실패하면 다음 Fallback을 시도하는 체인 생성.
     *
     * <p>다음 Fallback도 실패하면 이전 오류를 suppressed로 첨부하여 전파합니다.</p>
     *
     * @param next 다음 Fallback (최종 템플릿 등)
     * @return 체인된 FallbackPolicy
     */
    default FallbackPolicy<T> orElse(FallbackPolicy<T> next) {
        Objects.requireNonNull(next, "next cannot be null");
        return context -> invoke(this, context).exceptionallyCompose(first ->
            invoke(next, context).exceptionallyCompose(second -> {
                Throwable firstCause = DefaultErrorClassifier.unwrap(first);
                Throwable secondCause = DefaultErrorClassifier.unwrap(second);
                if (secondCause != firstCause) {
                    secondCause.addSuppressed(firstCause);
                }
                return CompletableFuture.failedFuture(secondCause);
            })
        );
    }

    /**
     * 고정 값 Fallback.
     *
     * @param value 대체 값
     * @param <T> 결과 타입
     * @return FallbackPolicy
     */
    static <T> FallbackPolicy<T> value(T value) {
        return context -> CompletableFuture.completedFuture(value);
    }

    /**
     * Supplier 기반 Fallback.
     *
     * @param supplier 대체 값 공급자
     * @param <T> 결과 타입
     * @return FallbackPolicy
     */
    static <T> FallbackPolicy<T> supplier(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        return context -> CompletableFuture.completedFuture(supplier.get());
    }

    /**
     * 컨텍스트 기반 동기 Fallback.
     *
     * @param function 컨텍스트를 받아 대체 값을 만드는 함수
     * @param <T> 결과 타입
     * @return FallbackPolicy
     */
    static <T> FallbackPolicy<T> of(Function<FallbackContext, T> function) {
        Objects.requireNonNull(function, "function cannot be null");
        return context -> CompletableFuture.completedFuture(function.apply(context));
    }

    /**
     * Fallback 호출 (동기 예외를 실패한 Future로 변환).
     *
     * @param policy Fallback
     * @param context 컨텍스트
     * @param <T> 결과 타입
     * @return 대체 결과 Future
     */
    static <T> CompletableFuture<T> invoke(FallbackPolicy<T> policy, FallbackContext context) {
        try {
            CompletionStage<T> stage = policy.recover(context);
            if (stage == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Fallback returned null stage for " + context.dependencyKey())
                );
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
