package com.ryuqq.resilience.core.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 기본 예외 분류기.
 *
 * <p><strong>분류 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>{@link ResilienceException}: 자체 kind</li>
 *   <li>{@link TimeoutException}: TIMEOUT</li>
 *   <li>{@link IOException}, {@link UncheckedIOException}: NETWORK</li>
 *   <li>{@link IllegalArgumentException}: VALIDATION</li>
 *   <li>그 외: SYSTEM</li>
 * </ol>
 *
 * <p>{@link CompletionException}, {@link ExecutionException}은 원인으로 풀어서 분류합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DefaultErrorClassifier implements ErrorClassifier {

    public static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

    private DefaultErrorClassifier() {
    }

    @Override
    public ErrorKind classify(Throwable error) {
        Throwable current = unwrap(error);
        if (current instanceof ResilienceException) {
            return ((ResilienceException) current).kind();
        }
        if (current instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (current instanceof IOException || current instanceof UncheckedIOException) {
            return ErrorKind.NETWORK;
        }
        if (current instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.SYSTEM;
    }

    /**
     * 비동기 래퍼 예외 제거.
     *
     * @param error 예외 (null 허용)
     * @return 래퍼가 제거된 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
