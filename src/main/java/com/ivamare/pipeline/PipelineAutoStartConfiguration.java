package com.ivamare.pipeline;

import com.ivamare.pipeline.controller.PipelineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Auto-start configuration for the pipeline controller.
 *
 * <p>Enable with:
 * <pre>
 * pipeline:
 *   auto-start: true
 * </pre>
 *
 * <p>The controller starts once the application is ready and is stopped, cancelling
 * in-flight downloads and uploads, when the context closes.
 */
@AutoConfiguration(after = PipelineAutoConfiguration.class)
@ConditionalOnBean(PipelineController.class)
@ConditionalOnProperty(prefix = "pipeline", name = "auto-start", havingValue = "true")
public class PipelineAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineAutoStartConfiguration.class);

    private final PipelineController controller;
    private final PipelineProperties properties;

    public PipelineAutoStartConfiguration(PipelineController controller, PipelineProperties properties) {
        this.controller = controller;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startPipeline() {
        controller.start();
    }

    @PreDestroy
    public void stopPipeline() {
        log.info("Stopping pipeline...");
        long timeoutMs = properties.getShutdownTimeout().toMillis();
        try {
            // Extra second for executor teardown after the in-flight wait
            controller.stop(properties.getShutdownTimeout()).get(timeoutMs + 1000, TimeUnit.MILLISECONDS);
            log.info("Pipeline stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping pipeline");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Pipeline did not stop cleanly: {}", e.getMessage());
        }
    }
}
