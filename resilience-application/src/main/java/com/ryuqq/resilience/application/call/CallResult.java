package com.ryuqq.resilience.application.call;

import com.ryuqq.resilience.core.fallback.FallbackReason;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Resilient 호출 결과.
 *
 * <p><strong>세 가지 출처:</strong></p>
 * <ul>
 *   <li><strong>LIVE:</strong> operation이 성공한 결과 (attempts &gt;= 1)</li>
 *   <li><strong>CACHED:</strong> 캐시 히트 (attempts = 0)</li>
 *   <li><strong>FALLBACK:</strong> 대체 결과. {@link #isDegraded()}가 true이며 사유를 포함</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallResult&lt;List&lt;Hit&gt;&gt; result = orchestrator.execute(request).join();
 * if (result.isDegraded()) {
 *     // 대체 결과: UI에 "일시적으로 제한된 결과" 표시
 * }
 * List&lt;Hit&gt; hits = result.getValue();
 * </pre>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CallResult<T> {

    private final T value;
    private final CallSource source;
    private final int attempts;
    private final Duration elapsed;
    private final FallbackReason degradedReason;

    private CallResult(T value, CallSource source, int attempts, Duration elapsed, FallbackReason degradedReason) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        this.value = value;
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.attempts = attempts;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed cannot be null");
        this.degradedReason = degradedReason;
    }

    /**
     * 실제 결과 생성.
     *
     * @param value 결과 값
     * @param attempts 수행한 시도 횟수 (1 이상)
     * @param elapsed 경과 시간
     * @param <T> 결과 타입
     * @return CallResult (source = LIVE)
     */
    public static <T> CallResult<T> live(T value, int attempts, Duration elapsed) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive for a live result (current: " + attempts + ")");
        }
        return new CallResult<>(value, CallSource.LIVE, attempts, elapsed, null);
    }

    /**
     * 캐시 결과 생성.
     *
     * @param value 캐시된 값
     * @param <T> 결과 타입
     * @return CallResult (source = CACHED)
     */
    public static <T> CallResult<T> cached(T value) {
        return new CallResult<>(value, CallSource.CACHED, 0, Duration.ZERO, null);
    }

    /**
     * 대체 결과 생성.
     *
     * @param value 대체 값
     * @param reason Fallback 사유
     * @param attempts 수행한 시도 횟수 (short circuit이면 0)
     * @param elapsed 경과 시간
     * @param <T> 결과 타입
     * @return CallResult (source = FALLBACK)
     */
    public static <T> CallResult<T> fallback(T value, FallbackReason reason, int attempts, Duration elapsed) {
        Objects.requireNonNull(reason, "reason cannot be null for a fallback result");
        return new CallResult<>(value, CallSource.FALLBACK, attempts, elapsed, reason);
    }

    public T getValue() {
        return value;
    }

    public CallSource getSource() {
        return source;
    }

    /**
     * operation 시도 횟수.
     *
     * @return 캐시 히트와 short circuit은 0
     */
    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * 대체 결과 여부.
     *
     * @return source가 FALLBACK이면 true
     */
    public boolean isDegraded() {
        return source == CallSource.FALLBACK;
    }

    public Optional<FallbackReason> getDegradedReason() {
        return Optional.ofNullable(degradedReason);
    }

    @Override
    public String toString() {
        return "CallResult{source=" + source + ", attempts=" + attempts + ", elapsed=" + elapsed.toMillis() + "ms"
            + (degradedReason == null ? "" : ", degradedReason=" + degradedReason) + "}";
    }
}
