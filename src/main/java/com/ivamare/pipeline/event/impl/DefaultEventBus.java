package com.ivamare.pipeline.event.impl;

import com.ivamare.pipeline.event.Event;
import com.ivamare.pipeline.event.EventBus;
import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.event.EventListener;
import com.ivamare.pipeline.event.EventType;
import com.ivamare.pipeline.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default EventBus keeping a bounded in-memory history.
 *
 * <p>The registry and the history have separate locks. Neither is held while listeners
 * run, so a listener may subscribe, unsubscribe or publish from inside its callback.
 */
public class DefaultEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventBus.class);

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private static final String COMPONENT = "event_bus";

    private final int historySize;
    private final Map<EventType, List<Registration>> subscribers = new EnumMap<>(EventType.class);
    private final Deque<Event> history = new ArrayDeque<>();
    private final ReentrantLock subscriberLock = new ReentrantLock();
    private final ReentrantLock historyLock = new ReentrantLock();
    private final AtomicLong nextId = new AtomicLong(1);

    public DefaultEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    /**
     * Creates an event bus.
     *
     * @param historySize Maximum number of retained events (0 disables history)
     */
    public DefaultEventBus(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must not be negative");
        }
        this.historySize = historySize;
    }

    @Override
    public Subscription subscribe(EventType eventType, EventListener listener) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener is required");
        }

        Subscription subscription = new Subscription(eventType, nextId.getAndIncrement());
        subscriberLock.lock();
        try {
            subscribers.computeIfAbsent(eventType, t -> new ArrayList<>())
                .add(new Registration(subscription, listener));
        } finally {
            subscriberLock.unlock();
        }

        log.debug("Subscribed listener #{} to {}", subscription.id(), eventType);
        return subscription;
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }

        subscriberLock.lock();
        try {
            List<Registration> registrations = subscribers.get(subscription.eventType());
            if (registrations != null
                    && registrations.removeIf(r -> r.subscription().equals(subscription))) {
                log.debug("Unsubscribed listener #{} from {}", subscription.id(), subscription.eventType());
                if (registrations.isEmpty()) {
                    subscribers.remove(subscription.eventType());
                }
            }
        } finally {
            subscriberLock.unlock();
        }
    }

    @Override
    public Event publish(EventType eventType, Map<String, Object> data, String source) {
        Event event = new Event(eventType, Instant.now(), data, source);

        record(event);

        List<Registration> snapshot;
        subscriberLock.lock();
        try {
            List<Registration> registrations = subscribers.get(eventType);
            snapshot = registrations != null ? List.copyOf(registrations) : List.of();
        } finally {
            subscriberLock.unlock();
        }

        log.trace("Publishing {} from {} to {} listeners", eventType, event.source(), snapshot.size());

        for (Registration registration : snapshot) {
            try {
                registration.listener().onEvent(event);
            } catch (Exception e) {
                handleListenerFailure(event, registration, e);
            }
        }

        return event;
    }

    @Override
    public List<Event> getEventHistory(EventType eventType, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        List<Event> result = new ArrayList<>(Math.min(limit, historySize));
        historyLock.lock();
        try {
            Iterator<Event> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                Event event = newestFirst.next();
                if (eventType == null || event.type() == eventType) {
                    result.add(event);
                }
            }
        } finally {
            historyLock.unlock();
        }
        return List.copyOf(result);
    }

    @Override
    public int getSubscriberCount(EventType eventType) {
        subscriberLock.lock();
        try {
            List<Registration> registrations = subscribers.get(eventType);
            return registrations != null ? registrations.size() : 0;
        } finally {
            subscriberLock.unlock();
        }
    }

    @Override
    public void clearHistory() {
        historyLock.lock();
        try {
            history.clear();
        } finally {
            historyLock.unlock();
        }
        log.debug("Event history cleared");
    }

    @Override
    public void clearAllSubscribers() {
        subscriberLock.lock();
        try {
            subscribers.clear();
        } finally {
            subscriberLock.unlock();
        }
        log.debug("All event subscribers cleared");
    }

    private void record(Event event) {
        if (historySize == 0) {
            return;
        }
        historyLock.lock();
        try {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        } finally {
            historyLock.unlock();
        }
    }

    private void handleListenerFailure(Event event, Registration registration, Exception e) {
        log.error("Listener #{} failed handling {}: {}",
            registration.subscription().id(), event.type(), e.getMessage(), e);

        // A failing error listener only gets logged, otherwise it would feed itself
        if (event.type() == EventType.ERROR_OCCURRED) {
            return;
        }

        Map<String, Object> data = EventData.error(COMPONENT,
            e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        data.put(EventData.FAILED_EVENT_TYPE, event.type().getValue());
        if (event.itemId() != null) {
            data.put(EventData.ITEM_ID, event.itemId());
        }
        publish(EventType.ERROR_OCCURRED, data, COMPONENT);
    }

    private record Registration(Subscription subscription, EventListener listener) {}
}
