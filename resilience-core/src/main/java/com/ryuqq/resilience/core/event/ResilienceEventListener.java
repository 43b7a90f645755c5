package com.ryuqq.resilience.core.event;

/**
 * Resilience 이벤트 수신자 (관측 협력자).
 *
 * <p>구현체는 thread-safe해야 하며, 호출 경로를 막지 않도록
 * 비동기 발행기를 통해 등록하는 것을 권장합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResilienceEventListener {

    /**
     * 아무 동작도 하지 않는 리스너.
     */
    ResilienceEventListener NO_OP = event -> { };

    /**
     * 이벤트 수신.
     *
     * @param event 이벤트
     */
    void onEvent(ResilienceEvent event);
}
