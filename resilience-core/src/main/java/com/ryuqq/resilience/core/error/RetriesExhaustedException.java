package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.CallAttemptResult;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 재시도 소진 오류.
 *
 * <p>마지막 오류(cause)를 호출 컨텍스트(의존성 키, 시도 횟수, 경과 시간, 시도 이력)로 감싼 예외입니다.
 * kind는 마지막 오류의 분류를 그대로 따릅니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RetriesExhaustedException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final String dependencyKey;
    private final int attempts;
    private final Duration elapsed;
    private final transient List<CallAttemptResult> history;
    private final ErrorKind lastErrorKind;
    private final Integer lastStatus;

    /**
     * 생성자.
     *
     * @param dependencyKey 의존성 키
     * @param attempts 수행한 시도 횟수 (1 이상)
     * @param elapsed 전체 경과 시간
     * @param history 시도 이력
     * @param lastErrorKind 마지막 오류 분류
     * @param lastStatus 마지막 HTTP 상태 코드 (null 허용)
     * @param cause 마지막 오류
     */
    public RetriesExhaustedException(
        String dependencyKey,
        int attempts,
        Duration elapsed,
        List<CallAttemptResult> history,
        ErrorKind lastErrorKind,
        Integer lastStatus,
        Throwable cause
    ) {
        super(
            "Retries exhausted for " + dependencyKey + " after " + attempts + " attempt(s) in "
                + (elapsed == null ? 0 : elapsed.toMillis()) + "ms"
                + (cause == null ? "" : ": " + cause.getMessage()),
            cause
        );
        if (dependencyKey == null || dependencyKey.isBlank()) {
            throw new IllegalArgumentException("dependencyKey cannot be null or blank");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        this.dependencyKey = dependencyKey;
        this.attempts = attempts;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed cannot be null");
        this.history = List.copyOf(Objects.requireNonNull(history, "history cannot be null"));
        this.lastErrorKind = Objects.requireNonNull(lastErrorKind, "lastErrorKind cannot be null");
        this.lastStatus = lastStatus;
    }

    public String getDependencyKey() {
        return dependencyKey;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public List<CallAttemptResult> getHistory() {
        return history;
    }

    public Integer getLastStatus() {
        return lastStatus;
    }

    @Override
    public ErrorKind kind() {
        return lastErrorKind;
    }
}
