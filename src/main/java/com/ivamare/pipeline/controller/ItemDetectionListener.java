package com.ivamare.pipeline.controller;

import java.util.Map;

/**
 * Entry point for detectors reporting newly found items.
 */
@FunctionalInterface
public interface ItemDetectionListener {

    /**
     * Report a detected item.
     *
     * @param payload Item data, must contain {@code item_id}
     */
    void onItemDetected(Map<String, Object> payload);
}
