package com.ryuqq.resilience.core.executor;

import java.util.concurrent.CompletionStage;

/**
 * 외부 의존성을 호출하는 비동기 작업.
 *
 * <p>Resilience 계층은 호출을 직접 구성하지 않고, 호출자가 제공한 Operation을 시도마다 다시 실행합니다.
 * 따라서 구현체는 호출될 때마다 새 요청을 시작해야 합니다.</p>
 *
 * <p>동기적으로 던진 예외는 해당 시도의 실패로 취급됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 작업 시작.
     *
     * @return 결과 Stage
     * @throws Exception 작업 시작 실패 시
     */
    CompletionStage<T> call() throws Exception;
}
