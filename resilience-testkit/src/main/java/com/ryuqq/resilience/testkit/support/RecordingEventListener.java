package com.ryuqq.resilience.testkit.support;

import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event listener that keeps every received event for later assertions.
 *
 * <p>Thread-safe; may be shared by components running on several threads.</p>
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

    /**
     * Returns all received events in arrival order.
     *
     * @return immutable snapshot
     */
    public List<ResilienceEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns events of a single type.
     *
     * @param type event type, e.g. {@link ResilienceEvent#RETRY_ATTEMPT}
     * @return matching events in arrival order
     */
    public List<ResilienceEvent> eventsOfType(String type) {
        return events.stream()
            .filter(event -> event.type().equals(type))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Counts events of a single type.
     *
     * @param type event type
     * @return number of matching events
     */
    public long count(String type) {
        return events.stream().filter(event -> event.type().equals(type)).count();
    }

    /**
     * Clears all recorded events.
     */
    public void clear() {
        events.clear();
    }
}
