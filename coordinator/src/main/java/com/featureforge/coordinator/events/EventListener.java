package com.featureforge.coordinator.events;

import com.featureforge.coordinator.model.Event;

/**
 * Callback registered with {@link EventBus#subscribe}.
 *
 * Invoked synchronously on the publishing thread after the event has been
 * committed. Exceptions are logged by the bus and never reach the publisher.
 */
@FunctionalInterface
public interface EventListener {
    void onEvent(Event event);
}
