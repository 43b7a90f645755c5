package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener that keeps every event it receives.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RecordingEventListener implements ResilienceEventListener {

    private final List<ResilienceEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(ResilienceEvent event) {
        events.add(event);
    }

    public List<ResilienceEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns recorded events of one type, in arrival order.
     *
     * @param type the event type
     * @param <E> the event type
     * @return matching events
     */
    public <E extends ResilienceEvent> List<E> eventsOf(Class<E> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public void clear() {
        events.clear();
    }
}
