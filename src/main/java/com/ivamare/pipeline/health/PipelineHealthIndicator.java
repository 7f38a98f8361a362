package com.ivamare.pipeline.health;

import com.ivamare.pipeline.controller.PipelineController;
import com.ivamare.pipeline.model.PipelineStatistics;
import com.ivamare.pipeline.model.QueueStatistics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>Whether the controller is running</li>
 *   <li>Pending, processing, completed and failed counts per stage</li>
 *   <li>In-flight worker counts</li>
 * </ul>
 */
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineController controller;

    public PipelineHealthIndicator(PipelineController controller) {
        this.controller = controller;
    }

    @Override
    public Health health() {
        if (controller == null) {
            return Health.unknown()
                .withDetail("message", "No pipeline controller configured")
                .build();
        }

        try {
            PipelineStatistics statistics = controller.getStatistics();
            Health.Builder builder = controller.isRunning() ? Health.up() : Health.down();

            return builder
                .withDetail("running", controller.isRunning())
                .withDetail("download", stageStatus(statistics.downloads(), statistics.activeDownloads()))
                .withDetail("upload", stageStatus(statistics.uploads(), statistics.activeUploads()))
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private static StageStatus stageStatus(QueueStatistics queue, int inFlight) {
        return new StageStatus(queue.pending(), queue.processing(), queue.completed(), queue.failed(), inFlight);
    }

    record StageStatus(int pending, int processing, int completed, int failed, int inFlight) {}
}
