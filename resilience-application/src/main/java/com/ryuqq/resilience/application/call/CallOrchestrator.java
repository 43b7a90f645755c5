package com.ryuqq.resilience.application.call;

import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.error.ValidationException;

import java.util.concurrent.CompletableFuture;

/**
 * 외부 의존성 호출 조정자.
 *
 * <p>호출자가 제공한 operation을 cache → circuit breaker → rate limit → retry → fallback 순서로 감싸
 * 하나의 호출 경로로 실행합니다.</p>
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>성공: {@link CallResult} (LIVE / CACHED / FALLBACK)</li>
 *   <li>입력 오류: {@link ValidationException} (동기적으로 즉시 던짐)</li>
 *   <li>재시도 소진 또는 Circuit Open, Fallback 없음: {@link ServiceException}으로 실패한 Future
 *       ({@code isRetryable() == true})</li>
 * </ul>
 *
 * <p>반환된 Future를 취소하면 진행 중인 대기(백오프, Rate Limit)가 취소되고
 * 다음 시도는 시작되지 않습니다. 취소된 호출은 성공도 실패도 아닙니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CallOrchestrator {

    /**
     * 호출 실행.
     *
     * @param request 호출 요청
     * @param <T> 결과 타입
     * @return 호출 결과 Future
     * @throws ValidationException request가 null이거나 유효하지 않은 경우
     */
    <T> CompletableFuture<CallResult<T>> execute(CallRequest<T> request);
}
