package com.ivamare.pipeline.sink.impl;

import com.ivamare.pipeline.model.ItemStatus;
import com.ivamare.pipeline.sink.ItemStatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Sink that only logs transitions. Used when no persistent sink is configured.
 */
public class LoggingItemStatusSink implements ItemStatusSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingItemStatusSink.class);

    @Override
    public void record(String itemId, ItemStatus status, Map<String, Object> details) {
        if (status == ItemStatus.FAILED) {
            log.warn("Item {} -> {} {}", itemId, status.getValue(), details);
        } else {
            log.info("Item {} -> {}", itemId, status.getValue());
        }
    }
}
