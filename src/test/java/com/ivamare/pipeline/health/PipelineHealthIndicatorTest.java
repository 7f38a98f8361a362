package com.ivamare.pipeline.health;

import com.ivamare.pipeline.controller.PipelineController;
import com.ivamare.pipeline.model.PipelineStatistics;
import com.ivamare.pipeline.model.QueueStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PipelineHealthIndicator")
class PipelineHealthIndicatorTest {

    private final PipelineController controller = mock(PipelineController.class);

    private static PipelineStatistics statistics() {
        return new PipelineStatistics(
            new QueueStatistics(3, 1, 10, 2),
            new QueueStatistics(0, 1, 9, 0),
            1,
            1
        );
    }

    @Test
    @DisplayName("should return UP with stage details when running")
    void shouldReturnUpWhenRunning() {
        when(controller.isRunning()).thenReturn(true);
        when(controller.getStatistics()).thenReturn(statistics());

        Health health = new PipelineHealthIndicator(controller).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(true, health.getDetails().get("running"));
        assertEquals(new PipelineHealthIndicator.StageStatus(3, 1, 10, 2, 1), health.getDetails().get("download"));
        assertEquals(new PipelineHealthIndicator.StageStatus(0, 1, 9, 0, 1), health.getDetails().get("upload"));
    }

    @Test
    @DisplayName("should return DOWN when stopped")
    void shouldReturnDownWhenStopped() {
        when(controller.isRunning()).thenReturn(false);
        when(controller.getStatistics()).thenReturn(statistics());

        Health health = new PipelineHealthIndicator(controller).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(false, health.getDetails().get("running"));
    }

    @Test
    @DisplayName("should return DOWN with error when statistics fail")
    void shouldReturnDownOnError() {
        when(controller.getStatistics()).thenThrow(new IllegalStateException("queue closed"));

        Health health = new PipelineHealthIndicator(controller).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("queue closed", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("should return UNKNOWN without controller")
    void shouldReturnUnknownWithoutController() {
        Health health = new PipelineHealthIndicator(null).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
    }
}
