package com.plughub.events;

import java.util.Objects;

/** One registration on the bus: event type, unique subscriber id (the cancellation handle) and listener. */
record Subscription(String eventType, String subscriberId, EventListener listener) {

    Subscription {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(listener, "listener");
    }
}
