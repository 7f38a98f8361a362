package com.ivamare.pipeline.event;

/**
 * Callback invoked synchronously on the publishing thread.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event);
}
