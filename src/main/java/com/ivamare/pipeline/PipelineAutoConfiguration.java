package com.ivamare.pipeline;

import com.ivamare.pipeline.controller.PipelineController;
import com.ivamare.pipeline.event.EventBus;
import com.ivamare.pipeline.event.impl.DefaultEventBus;
import com.ivamare.pipeline.operation.DownloadOperation;
import com.ivamare.pipeline.operation.StageOperation;
import com.ivamare.pipeline.operation.UploadOperation;
import com.ivamare.pipeline.policy.RetryPolicy;
import com.ivamare.pipeline.queue.TaskQueue;
import com.ivamare.pipeline.queue.impl.PriorityTaskQueue;
import com.ivamare.pipeline.ratelimit.UploadQuota;
import com.ivamare.pipeline.sink.ItemStatusSink;
import com.ivamare.pipeline.sink.impl.JdbcItemStatusSink;
import com.ivamare.pipeline.sink.impl.LoggingItemStatusSink;
import com.ivamare.pipeline.worker.Stage;
import com.ivamare.pipeline.worker.WorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Auto-configuration for the video pipeline.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event Bus</li>
 *   <li>Retry Policy</li>
 *   <li>Item Status Sink (logging, or JDBC with {@code pipeline.sink.type=jdbc})</li>
 *   <li>Upload Quota</li>
 *   <li>Pipeline Controller, once the application provides a {@link DownloadOperation}
 *       and an {@link UploadOperation} bean</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * pipeline.enabled=false
 * </pre>
 */
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineAutoConfiguration {

    // --- Event Bus ---

    @Bean
    @ConditionalOnMissingBean
    public EventBus pipelineEventBus(PipelineProperties properties) {
        return new DefaultEventBus(properties.getEventHistorySize());
    }

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy pipelineRetryPolicy(PipelineProperties properties) {
        return new RetryPolicy(
            properties.getRetry().getMaxRetries(),
            properties.getRetry().getBackoffSchedule()
        );
    }

    // --- Status Sink ---

    @Bean
    @ConditionalOnMissingBean
    public ItemStatusSink itemStatusSink(
            PipelineProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            ObjectProvider<ObjectMapper> objectMapper) {
        if (properties.getSink().getType() == PipelineProperties.SinkType.JDBC) {
            JdbcTemplate template = jdbcTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("pipeline.sink.type=jdbc requires a JdbcTemplate bean");
            }
            ObjectMapper mapper = objectMapper.getIfAvailable(() -> {
                ObjectMapper fallback = new ObjectMapper();
                fallback.findAndRegisterModules();
                return fallback;
            });
            return new JdbcItemStatusSink(template, mapper);
        }
        return new LoggingItemStatusSink();
    }

    // --- Upload Quota ---

    @Bean
    @ConditionalOnMissingBean
    public UploadQuota uploadQuota(PipelineProperties properties) {
        PipelineProperties.QuotaProperties quota = properties.getUpload().getQuota();
        return UploadQuota.of(quota.getPermits(), quota.getPeriod());
    }

    // --- Controller ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({DownloadOperation.class, UploadOperation.class})
    public PipelineController pipelineController(
            PipelineProperties properties,
            EventBus eventBus,
            RetryPolicy retryPolicy,
            ItemStatusSink itemStatusSink,
            UploadQuota uploadQuota,
            DownloadOperation downloadOperation,
            UploadOperation uploadOperation) {
        PipelineProperties.StageProperties download = properties.getDownload();
        PipelineProperties.UploadProperties upload = properties.getUpload();

        TaskQueue downloadQueue = new PriorityTaskQueue(
            Stage.DOWNLOAD.getValue(), download.getConcurrency(), retryPolicy, Clock.systemUTC());
        TaskQueue uploadQueue = new PriorityTaskQueue(
            Stage.UPLOAD.getValue(), upload.getConcurrency(), retryPolicy, Clock.systemUTC());

        WorkerPool downloadPool = WorkerPool.builder()
            .stage(Stage.DOWNLOAD)
            .queue(downloadQueue)
            .eventBus(eventBus)
            .operation(StageOperation.forDownload(downloadOperation))
            .concurrency(download.getConcurrency())
            .operationTimeout(download.getOperationTimeout())
            .build();

        WorkerPool uploadPool = WorkerPool.builder()
            .stage(Stage.UPLOAD)
            .queue(uploadQueue)
            .eventBus(eventBus)
            .operation(StageOperation.forUpload(uploadOperation))
            .concurrency(upload.getConcurrency())
            .operationTimeout(upload.getOperationTimeout())
            .build();

        return new PipelineController(
            eventBus,
            downloadQueue,
            downloadPool,
            uploadQueue,
            uploadPool,
            itemStatusSink,
            uploadQuota,
            properties.getTickInterval()
        );
    }
}
