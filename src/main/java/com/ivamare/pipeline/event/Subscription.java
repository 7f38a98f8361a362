package com.ivamare.pipeline.event;

/**
 * Handle returned by {@link EventBus#subscribe(EventType, EventListener)}.
 *
 * @param eventType Subscribed event type
 * @param id Registration id, unique per bus
 */
public record Subscription(EventType eventType, long id) {
}
