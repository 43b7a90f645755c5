package com.ryuqq.resilience.core.fallback;

import com.ryuqq.resilience.core.model.DependencyKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FallbackPolicy 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class FallbackPolicyTest {

    private final FallbackContext context = new FallbackContext(
        DependencyKey.of("serper"),
        FallbackReason.RETRIES_EXHAUSTED,
        4,
        new IllegalStateException("last"),
        Map.of("query", "coffee")
    );

    @Test
    void value_ReturnsFixedValue() {
        assertEquals(List.of(), FallbackPolicy.value(List.of()).recover(context).toCompletableFuture().join());
    }

    @Test
    void of_ReceivesContext() {
        FallbackPolicy<String> policy = FallbackPolicy.of(ctx -> ctx.reason() + ":" + ctx.attributes().get("query"));

        assertEquals("RETRIES_EXHAUSTED:coffee", policy.recover(context).toCompletableFuture().join());
    }

    @Test
    void orElse_FirstFails_UsesNext() {
        // Given
        FallbackPolicy<String> stale = FallbackPolicy.supplier(() -> {
            throw new IllegalStateException("no stale data");
        });

        // When
        String result = FallbackPolicy.invoke(stale.orElse(FallbackPolicy.value("template")), context).join();

        // Then
        assertEquals("template", result);
    }

    @Test
    void orElse_FirstSucceeds_SkipsNext() {
        FallbackPolicy<String> chain = FallbackPolicy.value("stale").orElse(ctx -> {
            throw new AssertionError("must not be called");
        });

        assertEquals("stale", FallbackPolicy.invoke(chain, context).join());
    }

    @Test
    void orElse_BothFail_AttachesFirstAsSuppressed() {
        // Given
        IllegalStateException first = new IllegalStateException("first");
        IllegalStateException second = new IllegalStateException("second");
        FallbackPolicy<String> chain = ((FallbackPolicy<String>) ctx -> CompletableFuture.failedFuture(first))
            .orElse(ctx -> CompletableFuture.failedFuture(second));

        // When
        CompletionException thrown = assertThrows(
            CompletionException.class,
            () -> FallbackPolicy.invoke(chain, context).join()
        );

        // Then
        assertSame(second, thrown.getCause());
        assertSame(first, second.getSuppressed()[0]);
    }

    @Test
    void invoke_NullStage_FailsFuture() {
        FallbackPolicy<String> broken = ctx -> null;

        CompletableFuture<String> future = FallbackPolicy.invoke(broken, context);

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void context_NegativeAttempts_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new FallbackContext(DependencyKey.of("k"), FallbackReason.CIRCUIT_OPEN, -1, null, null)
        );
    }
}
