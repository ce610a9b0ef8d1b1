package com.plughub.events;

import java.util.Map;
import java.util.Objects;

/**
 * Event delivered to listeners: the event type it was published under and its payload.
 * Payload may be null. Lifecycle events published by the plugin manager carry a
 * {@code Map<String, Object>}; use {@link #payloadAsMap()} for those.
 */
public record Event(String type, Object payload) {

    public Event {
        Objects.requireNonNull(type, "type");
    }

    /** Payload as a map, or an empty map when the payload is null or not a map. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> payloadAsMap() {
        return payload instanceof Map ? (Map<String, Object>) payload : Map.of();
    }
}
