package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.spi.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ScheduledExecutorService} 기반 {@link Sleeper}.
 *
 * <p>스레드를 점유하지 않고 지정 시간 후 Future를 완료합니다.
 * 반환된 Future를 취소하면 예약된 작업도 취소됩니다.</p>
 *
 * <p>{@link #close()} 시점에 대기 중인 Future는 {@link CancellationException}으로 완료됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ScheduledSleeper implements Sleeper, AutoCloseable {

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

    /**
     * 단일 daemon 스레드 스케줄러를 소유하는 생성자.
     */
    public ScheduledSleeper() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "resilience-sleeper");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * 외부 스케줄러를 사용하는 생성자 (close 시 종료하지 않음).
     *
     * @param scheduler 스케줄러
     */
    public ScheduledSleeper(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private ScheduledSleeper(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public CompletableFuture<Void> sleep(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        pending.add(future);
        ScheduledFuture<?> task;
        try {
            task = scheduler.schedule(
                () -> future.complete(null),
                duration.toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            pending.remove(future);
            CancellationException closed = new CancellationException("Sleeper closed");
            closed.initCause(e);
            future.completeExceptionally(closed);
            return future;
        }
        future.whenComplete((ignored, error) -> {
            pending.remove(future);
            if (future.isCancelled()) {
                task.cancel(false);
            }
        });
        return future;
    }

    /**
     * 대기 중인 sleep 수.
     *
     * @return 아직 완료되지 않은 sleep 수
     */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        for (CompletableFuture<Void> future : pending) {
            future.completeExceptionally(new CancellationException("Sleeper closed"));
        }
        pending.clear();
    }
}
