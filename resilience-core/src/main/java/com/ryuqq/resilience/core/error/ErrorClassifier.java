package com.ryuqq.resilience.core.error;

/**
 * 예외 분류 SPI.
 *
 * <p>operation이 던진 임의의 예외를 {@link ErrorKind}로 분류합니다.
 * 상위 SDK 예외를 도메인 분류로 매핑해야 하는 경우 구현을 교체합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * 예외 분류.
     *
     * @param error 분류할 예외 (CompletionException 등 래퍼가 제거된 원인)
     * @return ErrorKind (null 불가)
     */
    ErrorKind classify(Throwable error);
}
