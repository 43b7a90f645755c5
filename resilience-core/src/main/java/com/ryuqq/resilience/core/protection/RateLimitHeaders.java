package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyKey;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 상위 응답 헤더를 {@link RateLimitInfo}로 변환.
 *
 * <p><strong>지원 헤더 (대소문자 무시):</strong></p>
 * <ul>
 *   <li>{@code x-ratelimit-remaining-requests}, {@code x-ratelimit-remaining-tokens}</li>
 *   <li>{@code x-ratelimit-reset-requests}, {@code x-ratelimit-reset-tokens}:
 *       기간 형식({@code 1h2m3s}, {@code 6m0s}, {@code 250ms}, {@code 1.5s}) 또는 epoch 초</li>
 *   <li>{@code retry-after}: 초 단위 정수</li>
 * </ul>
 *
 * <p><strong>resetTime 결정 규칙:</strong></p>
 * <ol>
 *   <li>소진된 쿼터가 있으면 소진된 쿼터의 reset 중 늦은 값</li>
 *   <li>아니면 존재하는 reset 중 이른 값</li>
 *   <li>retry-after가 있으면 now + retryAfter 보다 이르지 않음</li>
 * </ol>
 *
 * <p>retry-after만 있고 남은 요청 수가 없으면 남은 요청 수를 0으로 간주합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RateLimitHeaders {

    public static final String REMAINING_REQUESTS = "x-ratelimit-remaining-requests";
    public static final String REMAINING_TOKENS = "x-ratelimit-remaining-tokens";
    public static final String RESET_REQUESTS = "x-ratelimit-reset-requests";
    public static final String RESET_TOKENS = "x-ratelimit-reset-tokens";
    public static final String RETRY_AFTER = "retry-after";

    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");
    private static final Pattern DURATION = Pattern.compile("^(?:\\d+(?:\\.\\d+)?(?:ms|h|m|s))+$");
    private static final Pattern NUMBER = Pattern.compile("^\\d+$");
    private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;

    private RateLimitHeaders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 헤더 파싱.
     *
     * @param key 의존성 키
     * @param headers 응답 헤더
     * @param now 현재 시각
     * @return Rate Limit 관련 헤더가 하나도 없으면 empty
     * @throws IllegalArgumentException 헤더 값 형식이 잘못된 경우
     */
    public static Optional<RateLimitInfo> parse(DependencyKey key, Map<String, String> headers, Instant now) {
        Map<String, String> normalized = new HashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && value != null && !value.isBlank()) {
                normalized.put(name.trim().toLowerCase(Locale.ROOT), value.trim());
            }
        });

        String remainingRequestsValue = normalized.get(REMAINING_REQUESTS);
        String remainingTokensValue = normalized.get(REMAINING_TOKENS);
        String resetRequestsValue = normalized.get(RESET_REQUESTS);
        String resetTokensValue = normalized.get(RESET_TOKENS);
        String retryAfterValue = normalized.get(RETRY_AFTER);

        if (remainingRequestsValue == null && remainingTokensValue == null
            && resetRequestsValue == null && resetTokensValue == null && retryAfterValue == null) {
            return Optional.empty();
        }

        Duration retryAfter = retryAfterValue == null ? null : Duration.ofSeconds(parseCount(RETRY_AFTER, retryAfterValue));
        long requests = remainingRequestsValue == null
            ? (retryAfter != null ? 0 : RateLimitInfo.UNKNOWN)
            : parseCount(REMAINING_REQUESTS, remainingRequestsValue);
        long tokens = remainingTokensValue == null ? RateLimitInfo.UNKNOWN : parseCount(REMAINING_TOKENS, remainingTokensValue);

        Instant requestsReset = resetRequestsValue == null ? null : parseResetTime(resetRequestsValue, now);
        Instant tokensReset = resetTokensValue == null ? null : parseResetTime(resetTokensValue, now);

        Instant resetTime = null;
        if (requests <= 0 && requestsReset != null) {
            resetTime = requestsReset;
        }
        if (tokens <= 0 && tokensReset != null) {
            resetTime = later(resetTime, tokensReset);
        }
        if (resetTime == null) {
            resetTime = earlier(requestsReset, tokensReset);
        }
        if (retryAfter != null) {
            resetTime = later(resetTime, now.plus(retryAfter));
        }
        if (resetTime == null) {
            resetTime = now;
        }
        return Optional.of(new RateLimitInfo(key, requests, tokens, resetTime, retryAfter));
    }

    /**
     * reset 헤더 값 파싱.
     *
     * @param value 기간 형식 또는 숫자
     * @param now 현재 시각
     * @return 쿼터 회복 시각
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static Instant parseResetTime(String value, Instant now) {
        String trimmed = value.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            long number = Long.parseLong(trimmed);
            return number >= EPOCH_SECONDS_THRESHOLD
                ? Instant.ofEpochSecond(number)
                : now.plusSeconds(number);
        }
        return now.plus(parseDuration(trimmed));
    }

    /**
     * 기간 형식 파싱 ({@code 1h2m3s}, {@code 250ms}, {@code 1.5s}).
     *
     * @param value 기간 문자열
     * @return Duration
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static Duration parseDuration(String value) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (!DURATION.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid rate limit duration (current: " + value + ")");
        }
        Matcher matcher = DURATION_PART.matcher(trimmed);
        BigDecimal millis = BigDecimal.ZERO;
        while (matcher.find()) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            switch (matcher.group(2)) {
                case "h":
                    millis = millis.add(amount.multiply(BigDecimal.valueOf(3_600_000L)));
                    break;
                case "m":
                    millis = millis.add(amount.multiply(BigDecimal.valueOf(60_000L)));
                    break;
                case "s":
                    millis = millis.add(amount.multiply(BigDecimal.valueOf(1_000L)));
                    break;
                default:
                    millis = millis.add(amount);
                    break;
            }
        }
        return Duration.ofMillis(millis.longValue());
    }

    private static long parseCount(String header, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(header + " must be an integer (current: " + value + ")", e);
        }
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static Instant earlier(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }
}
