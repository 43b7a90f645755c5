package com.ryuqq.resilience.core.model;

/**
 * 외부 의존성(dependency)의 식별자.
 *
 * <p>Circuit Breaker, Rate Limit 추적 등 보호 상태는 모두 DependencyKey 단위로 관리됩니다.
 * 예: {@code serper}, {@code openai:chat}, {@code firecrawl.scrape}</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DependencyKey {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private DependencyKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("DependencyKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("DependencyKey length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException(
                "DependencyKey contains invalid characters. Only alphanumeric, hyphen, underscore, dot and colon are allowed"
            );
        }
        this.value = value;
    }

    /**
     * DependencyKey 생성.
     *
     * @param value 키 값
     * @return DependencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static DependencyKey of(String value) {
        return new DependencyKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyKey that = (DependencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
