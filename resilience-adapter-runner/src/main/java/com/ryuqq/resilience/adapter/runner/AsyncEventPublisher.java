package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget 이벤트 발행기.
 *
 * <p>이벤트를 {@link Executor}에 넘겨 호출 경로를 막지 않습니다.
 * 수신자 예외는 ERROR로 기록되고 다른 수신자에게 전파되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class AsyncEventPublisher implements ResilienceEventListener {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventPublisher.class);

    private final Executor executor;
    private final List<ResilienceEventListener> listeners;

    /**
     * 생성자.
     *
     * @param executor 이벤트 전달 Executor
     * @param listeners 수신자 목록
     */
    public AsyncEventPublisher(Executor executor, List<ResilienceEventListener> listeners) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners cannot be null"));
    }

    @Override
    public void onEvent(ResilienceEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Event dropped, executor rejected: type={}, key={}",
                event.getClass().getSimpleName(), event.dependencyKey());
        }
    }

    private void deliver(ResilienceEvent event) {
        for (ResilienceEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed: type={}, key={}",
                    event.getClass().getSimpleName(), event.dependencyKey(), e);
            }
        }
    }
}
