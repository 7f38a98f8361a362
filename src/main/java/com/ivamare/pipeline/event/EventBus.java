package com.ivamare.pipeline.event;

import java.util.List;
import java.util.Map;

/**
 * In-process publish/subscribe hub.
 *
 * <p>Listeners are invoked synchronously on the publishing thread in registration
 * order. A listener failure never propagates to the publisher or to other listeners.
 */
public interface EventBus {

    /**
     * Register a listener for an event type.
     *
     * <p>Registering the same listener twice creates two registrations.
     *
     * @param eventType Event type to listen for
     * @param listener Callback
     * @return handle used to unsubscribe
     */
    Subscription subscribe(EventType eventType, EventListener listener);

    /**
     * Remove a registration. Unknown or already removed handles are ignored.
     *
     * @param subscription Handle returned by subscribe
     */
    void unsubscribe(Subscription subscription);

    /**
     * Publish an event to all current listeners of its type.
     *
     * @param eventType Event type
     * @param data Payload, copied into the event
     * @param source Publishing component name
     * @return the published event
     */
    Event publish(EventType eventType, Map<String, Object> data, String source);

    /**
     * Get recent events, most recent first.
     *
     * @param eventType Type filter, or null for all types
     * @param limit Maximum number of events
     * @return immutable snapshot
     */
    List<Event> getEventHistory(EventType eventType, int limit);

    int getSubscriberCount(EventType eventType);

    void clearHistory();

    void clearAllSubscribers();
}
