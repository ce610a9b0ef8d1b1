package com.plughub.events;

/**
 * Callback registered with {@link EventBus#subscribe(String, EventListener)}.
 * Exceptions thrown here are caught by the bus, logged with the event type and subscriber id,
 * and do not prevent delivery to the remaining subscribers.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event) throws Exception;
}
