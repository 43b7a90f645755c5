package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.executor.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Operation} that plays back a fixed script of outcomes.
 *
 * <p>Each invocation consumes the next step; the last step repeats once the script runs out.</p>
 *
 * <pre>
 * ScriptedOperation&lt;String&gt; op = ScriptedOperation.&lt;String&gt;failing(new NetworkException("reset"))
 *     .thenFail(new NetworkException("reset"))
 *     .thenReturn("ok");
 * </pre>
 *
 * @param <T> the result type
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ScriptedOperation<T> implements Operation<T> {

    private final List<Step<T>> steps = new ArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<CompletableFuture<T>> hanging = new CopyOnWriteArrayList<>();

    private ScriptedOperation() {
    }

    public static <T> ScriptedOperation<T> returning(T value) {
        return new ScriptedOperation<T>().thenReturn(value);
    }

    public static <T> ScriptedOperation<T> failing(Exception error) {
        return new ScriptedOperation<T>().thenFail(error);
    }

    /**
     * Fails {@code failures} times with the given error, then returns {@code value}.
     *
     * @param failures number of leading failures
     * @param error the error to fail with
     * @param value the eventual value
     * @param <T> the result type
     * @return the scripted operation
     */
    public static <T> ScriptedOperation<T> failingTimes(int failures, Exception error, T value) {
        ScriptedOperation<T> operation = new ScriptedOperation<>();
        for (int i = 0; i < failures; i++) {
            operation.thenFail(error);
        }
        return operation.thenReturn(value);
    }

    public static <T> ScriptedOperation<T> hanging() {
        return new ScriptedOperation<T>().thenHang();
    }

    public ScriptedOperation<T> thenReturn(T value) {
        steps.add(new Step<>(value, null, false));
        return this;
    }

    public ScriptedOperation<T> thenFail(Exception error) {
        steps.add(new Step<>(null, error, false));
        return this;
    }

    public ScriptedOperation<T> thenHang() {
        steps.add(new Step<>(null, null, true));
        return this;
    }

    @Override
    public CompletionStage<T> call() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("ScriptedOperation has no steps");
        }
        int index = invocations.getAndIncrement();
        Step<T> step = steps.get(Math.min(index, steps.size() - 1));
        if (step.hang()) {
            CompletableFuture<T> future = new CompletableFuture<>();
            hanging.add(future);
            return future;
        }
        if (step.error() != null) {
            return CompletableFuture.failedFuture(step.error());
        }
        return CompletableFuture.completedFuture(step.value());
    }

    public int invocations() {
        return invocations.get();
    }

    /**
     * Returns the futures handed out by hanging steps.
     *
     * @return futures that never complete on their own
     */
    public List<CompletableFuture<T>> hangingCalls() {
        return List.copyOf(hanging);
    }

    private record Step<T>(T value, Exception error, boolean hang) {
    }
}
