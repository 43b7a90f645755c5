package com.ryuqq.resilience.application.call;

import com.ryuqq.resilience.core.fallback.FallbackReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CallResult 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CallResultTest {

    @Test
    void live_결과는_degraded가_아님() {
        CallResult<String> result = CallResult.live("value", 3, Duration.ofMillis(120));

        assertThat(result.getSource()).isEqualTo(CallSource.LIVE);
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getDegradedReason()).isEmpty();
    }

    @Test
    void cached_결과는_시도_0회() {
        CallResult<String> result = CallResult.cached("value");

        assertThat(result.getSource()).isEqualTo(CallSource.CACHED);
        assertThat(result.getAttempts()).isZero();
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    void fallback_결과는_degraded이며_사유_포함() {
        CallResult<String> result = CallResult.fallback("empty", FallbackReason.CIRCUIT_OPEN, 0, Duration.ZERO);

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getDegradedReason()).contains(FallbackReason.CIRCUIT_OPEN);
        assertThat(result.toString()).contains("FALLBACK").contains("CIRCUIT_OPEN");
    }

    @Test
    void live_결과의_시도_횟수는_1_이상() {
        assertThatThrownBy(() -> CallResult.live("value", 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
