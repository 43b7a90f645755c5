package com.ryuqq.resilience.adapter.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ScheduledSleeper 유닛 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ScheduledSleeperTest {

    private final ScheduledSleeper sleeper = new ScheduledSleeper();

    @AfterEach
    void tearDown() {
        sleeper.close();
    }

    @Test
    void sleep_0이하는_즉시_완료() {
        // when & then
        assertThat(sleeper.sleep(Duration.ZERO)).isDone();
        assertThat(sleeper.sleep(Duration.ofMillis(-5))).isDone();
    }

    @Test
    void sleep_지정_시간_후_완료() {
        // when
        CompletableFuture<Void> future = sleeper.sleep(Duration.ofMillis(20));

        // then
        assertThat(future).succeedsWithin(Duration.ofSeconds(2));
    }

    @Test
    void sleep_취소_시_예약_작업도_취소() throws Exception {
        // given
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ScheduledSleeper external = new ScheduledSleeper(scheduler);
            CompletableFuture<Void> future = external.sleep(Duration.ofMinutes(10));

            // when
            future.cancel(true);

            // then
            assertThat(future).isCancelled();
            external.close();
            assertThat(scheduler.isShutdown()).isFalse();
            scheduler.shutdown();
            assertThat(scheduler.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void close_시_대기_중인_sleep은_취소로_완료() {
        // given
        ScheduledSleeper owned = new ScheduledSleeper();
        CompletableFuture<Void> future = owned.sleep(Duration.ofSeconds(1));
        assertThat(owned.pendingCount()).isEqualTo(1);

        // when
        owned.close();

        // then
        assertThat(future).isDone();
        assertThat(future).isCompletedExceptionally();
        assertThat(future.handle((ignored, error) -> error).join()).isInstanceOf(CancellationException.class);
        assertThat(owned.pendingCount()).isZero();
    }

    @Test
    void close_이후_sleep은_즉시_취소로_완료() {
        // given
        ScheduledSleeper owned = new ScheduledSleeper();
        owned.close();

        // when
        CompletableFuture<Void> future = owned.sleep(Duration.ofSeconds(1));

        // then
        assertThat(future).isDone();
        assertThat(future.handle((ignored, error) -> error).join()).isInstanceOf(CancellationException.class);
        assertThat(owned.pendingCount()).isZero();
    }
}
