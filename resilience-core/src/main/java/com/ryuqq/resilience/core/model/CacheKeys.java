package com.ryuqq.resilience.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 캐시 키 정규화 유틸리티.
 *
 * <p>동일한 의미의 요청이 동일한 캐시 키를 갖도록 정규화합니다.</p>
 *
 * <ul>
 *   <li>문자열 값: 앞뒤 공백 제거 + 소문자 변환 (예: " New York " → "new york")</li>
 *   <li>파라미터 맵: 키 이름 기준 정렬 (입력 순서와 무관)</li>
 *   <li>null 값 파라미터: 제외</li>
 * </ul>
 *
 * <pre>{@code
 * String key = CacheKeys.of("serper", "search", Map.of("q", "Best Coffee", "gl", "US"));
 * // "serper:search:gl=us&q=best coffee"
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CacheKeys {

    private CacheKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 파라미터 맵으로 캐시 키 생성.
     *
     * @param dependency 의존성 이름
     * @param operation 작업 이름
     * @param params 파라미터 (null 허용)
     * @return 정규화된 캐시 키
     * @throws IllegalArgumentException dependency 또는 operation이 null/blank인 경우
     */
    public static String of(String dependency, String operation, Map<String, ?> params) {
        requireText(dependency, "dependency");
        requireText(operation, "operation");

        StringJoiner joiner = new StringJoiner("&");
        if (params != null) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<String, ?> entry : params.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    sorted.put(normalize(entry.getKey()), entry.getValue());
                }
            }
            sorted.forEach((name, value) -> joiner.add(name + "=" + normalize(String.valueOf(value))));
        }
        return normalize(dependency) + ":" + normalize(operation) + ":" + joiner;
    }

    /**
     * 위치 기반 파라미터로 캐시 키 생성.
     *
     * @param dependency 의존성 이름
     * @param operation 작업 이름
     * @param parts 파라미터 값 (순서 유지, null은 빈 문자열)
     * @return 정규화된 캐시 키
     */
    public static String of(String dependency, String operation, String... parts) {
        requireText(dependency, "dependency");
        requireText(operation, "operation");

        StringJoiner joiner = new StringJoiner("|");
        for (String part : parts) {
            joiner.add(part == null ? "" : normalize(part));
        }
        return normalize(dependency) + ":" + normalize(operation) + ":" + joiner;
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
