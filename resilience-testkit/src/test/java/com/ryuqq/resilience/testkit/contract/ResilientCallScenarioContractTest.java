package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.adapter.runner.ResilienceConfig;
import com.ryuqq.resilience.application.call.CallResult;
import com.ryuqq.resilience.application.call.CallSource;
import com.ryuqq.resilience.core.error.NetworkException;
import com.ryuqq.resilience.core.error.ServiceException;
import com.ryuqq.resilience.core.fallback.FallbackPolicy;
import com.ryuqq.resilience.core.fallback.FallbackReason;
import com.ryuqq.resilience.core.model.DependencyKey;
import com.ryuqq.resilience.core.model.RetryPolicy;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.ResponseCache;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for end-to-end resilient call scenarios.
 *
 * <p>Each test drives the full call path (cache, breaker, rate limit, retry, fallback)
 * through one {@link com.ryuqq.resilience.adapter.runner.ResilientCallExecutor}.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ResilientCallScenarioContractTest extends AbstractResilienceContractTest {

    private static final String KEY = "k";

    @Override
    protected ResilienceConfig config() {
        return new ResilienceConfig()
                .withCircuitBreaker(new CircuitBreakerConfig(3, Duration.ofSeconds(60)));
    }

    @Test
    void testScenario_FourthCallShortCircuitsToFallback() {
        // Given: three consecutive failed calls
        RetryPolicy noRetry = new RetryPolicy().withMaxRetries(0);
        for (int i = 0; i < 3; i++) {
            awaitFailure(executor.execute(
                    request(KEY, ScriptedOperation.<String>failing(new NetworkException("down")))
                            .retryPolicy(noRetry)
                            .build()), ServiceException.class);
        }
        assertCircuitState(KEY, CircuitBreakerState.OPEN);

        // When: a fourth call inside the open window
        clock.advance(Duration.ofSeconds(10));
        ScriptedOperation<String> operation = ScriptedOperation.returning("live");
        CallResult<String> result = await(executor.execute(request(KEY, operation)
                .fallback(FallbackPolicy.value("degraded"))
                .build()));

        // Then
        assertEquals(0, operation.invocations());
        assertEquals(CallSource.FALLBACK, result.getSource());
        assertEquals("degraded", result.getValue());
        assertEquals(Optional.of(FallbackReason.CIRCUIT_OPEN), result.getDegradedReason());
    }

    @Test
    void testScenario_FailsTwiceThenSucceeds() {
        // Given
        ScriptedOperation<String> operation =
                ScriptedOperation.failingTimes(2, new NetworkException("connection reset"), "success");

        // When
        CallResult<String> result = await(executor.execute(request(KEY, operation)
                .retryPolicy(new RetryPolicy().withMaxRetries(3))
                .build()));

        // Then
        assertEquals("success", result.getValue());
        assertEquals(CallSource.LIVE, result.getSource());
        assertEquals(3, result.getAttempts());
        assertCircuitState(KEY, CircuitBreakerState.CLOSED);
        assertEquals(0, circuit(KEY).failureCount());
    }

    @Test
    void testScenario_CacheTtlBoundary() {
        // Given: set at t=0 with TTL 1000ms
        ResponseCache cache = registry.getResponseCache();
        cache.set("summary", "cached", Duration.ofMillis(1000));

        // When & Then
        clock.set(START.plusMillis(999));
        assertEquals(Optional.of("cached"), cache.get("summary"));

        clock.set(START.plusMillis(1001));
        assertEquals(Optional.empty(), cache.get("summary"));
    }

    @Test
    void testScenario_RateLimitWaitThenClear() {
        // Given: resetTime = +5000ms, remainingRequests = 0
        DependencyKey key = DependencyKey.of(KEY);
        registry.getRateLimitTracker().updateFromResponse(key, 0, 1000, START.plusMillis(5000), null);

        // When
        registry.getRateLimitTracker().waitIfNeeded(key).join();

        // Then
        assertEquals(List.of(Duration.ofMillis(5000)), sleeper.sleeps());
        assertTrue(registry.getRateLimitTracker().status(key).isEmpty());
    }

    @Test
    void testScenario_CancelledRateLimitWaitNeverCallsOperation() {
        // Given
        DependencyKey key = DependencyKey.of(KEY);
        registry.getRateLimitTracker().updateFromResponse(key, 0, 1000, START.plusMillis(5000), null);
        sleeper.hold();
        ScriptedOperation<String> operation = ScriptedOperation.returning("live");

        // When
        CompletableFuture<CallResult<String>> future = executor.execute(request(KEY, operation).build());
        future.cancel(true);
        sleeper.releaseAll();

        // Then
        assertTrue(future.isCancelled());
        assertEquals(0, operation.invocations());
        assertEquals(START, clock.instant());
        assertEquals(0, circuit(KEY).failureCount());
    }
}
