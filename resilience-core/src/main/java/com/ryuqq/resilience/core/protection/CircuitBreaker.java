package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.util.Map;

/**
 * 의존성 키 단위 Circuit Breaker SPI.
 *
 * <p>의존성별 연속 실패를 집계하고, 임계값 도달 시 openTimeout 동안 호출을 차단하여
 * 장애가 호출자에게 전파되는 것을 막습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>모든 메서드는 동기, O(1), I/O 없음</li>
 *   <li>키당 상태는 최대 하나이며, 첫 실패 시점에 생성</li>
 *   <li>상태가 없는 키는 CLOSED로 간주</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (breaker.isOpen(key)) {
 *     return fallback();
 * }
 * try {
 *     T result = call();
 *     breaker.reset(key);
 *     return result;
 * } catch (ServiceException e) {
 *     breaker.recordFailure(key);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 차단 여부 조회.
     *
     * <ul>
     *   <li>OPEN, openTimeout 미경과: true</li>
     *   <li>OPEN, openTimeout 경과: HALF_OPEN으로 전이 후 false (시험 호출 1회 허용)</li>
     *   <li>HALF_OPEN, 시험 호출 진행 중: true</li>
     *   <li>CLOSED 또는 상태 없음: false</li>
     * </ul>
     *
     * @param key 의존성 키
     * @return 호출을 차단해야 하면 true
     */
    boolean isOpen(DependencyKey key);

    /**
     * 실패 기록.
     *
     * <p>실패 횟수를 증가시키고 마지막 실패 시각을 갱신합니다.
     * 실패 횟수가 임계값 이상이 되거나 HALF_OPEN 상태이면 OPEN으로 전이합니다.</p>
     *
     * @param key 의존성 키
     */
    void recordFailure(DependencyKey key);

    /**
     * 성공 기록 (CLOSED로 리셋).
     *
     * <p>실패 횟수를 0으로 되돌립니다. HALF_OPEN 시험 호출 성공 시에도 호출됩니다.</p>
     *
     * @param key 의존성 키
     */
    void reset(DependencyKey key);

    /**
     * 키별 상태 스냅샷 조회.
     *
     * <p>상태 전이를 일으키지 않습니다.</p>
     *
     * @param key 의존성 키
     * @return 스냅샷 (상태가 없으면 CLOSED 스냅샷)
     */
    CircuitBreakerSnapshot snapshot(DependencyKey key);

    /**
     * 전체 상태 스냅샷 조회.
     *
     * @return 키별 스냅샷 (불변)
     */
    Map<DependencyKey, CircuitBreakerSnapshot> snapshots();
}
