package com.ivamare.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the video pipeline.
 *
 * <p>Example configuration:
 * <pre>
 * pipeline:
 *   enabled: true
 *   auto-start: true
 *   tick-interval: 2s
 *   shutdown-timeout: 30s
 *   event-history-size: 1000
 *   retry:
 *     max-retries: 3
 *     backoff-schedule: [30, 120, 600]
 *   download:
 *     concurrency: 1
 *     operation-timeout: 1h
 *   upload:
 *     concurrency: 1
 *     operation-timeout: 2h
 *     quota:
 *       permits: 6
 *       period: 24h
 *   sink:
 *     type: jdbc
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Enable/disable pipeline auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Start the controller when the application is ready.
     */
    private boolean autoStart = false;

    /**
     * Interval between dispatch ticks.
     */
    private Duration tickInterval = Duration.ofSeconds(2);

    /**
     * Maximum wait for in-flight workers on shutdown.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Number of events kept in the event bus history.
     */
    private int eventHistorySize = 1000;

    private RetryProperties retry = new RetryProperties();

    private StageProperties download = new StageProperties(Duration.ofHours(1));

    private UploadProperties upload = new UploadProperties();

    private SinkProperties sink = new SinkProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getEventHistorySize() {
        return eventHistorySize;
    }

    public void setEventHistorySize(int eventHistorySize) {
        this.eventHistorySize = eventHistorySize;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public StageProperties getDownload() {
        return download;
    }

    public void setDownload(StageProperties download) {
        this.download = download;
    }

    public UploadProperties getUpload() {
        return upload;
    }

    public void setUpload(UploadProperties upload) {
        this.upload = upload;
    }

    public SinkProperties getSink() {
        return sink;
    }

    public void setSink(SinkProperties sink) {
        this.sink = sink;
    }

    /**
     * Retry budget shared by both stages.
     */
    public static class RetryProperties {

        /**
         * Failed attempts after which a task stays failed.
         */
        private int maxRetries = 3;

        /**
         * Delay in seconds before each retry; the last value repeats. Empty for no delay.
         */
        private List<Integer> backoffSchedule = new ArrayList<>();

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<Integer> getBackoffSchedule() {
            return backoffSchedule;
        }

        public void setBackoffSchedule(List<Integer> backoffSchedule) {
            this.backoffSchedule = backoffSchedule;
        }
    }

    /**
     * Worker settings of one stage.
     */
    public static class StageProperties {

        /**
         * Number of concurrent workers.
         */
        private int concurrency = 1;

        /**
         * Maximum duration of one attempt; zero disables the timeout.
         */
        private Duration operationTimeout;

        public StageProperties() {
            this(Duration.ZERO);
        }

        public StageProperties(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getOperationTimeout() {
            return operationTimeout;
        }

        public void setOperationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
        }
    }

    /**
     * Upload stage settings.
     */
    public static class UploadProperties extends StageProperties {

        private QuotaProperties quota = new QuotaProperties();

        public UploadProperties() {
            super(Duration.ofHours(2));
        }

        public QuotaProperties getQuota() {
            return quota;
        }

        public void setQuota(QuotaProperties quota) {
            this.quota = quota;
        }
    }

    /**
     * Limit on upload starts per period.
     */
    public static class QuotaProperties {

        /**
         * Uploads allowed per period; 0 disables the quota.
         */
        private long permits = 0;

        /**
         * Refill period.
         */
        private Duration period = Duration.ofHours(24);

        public long getPermits() {
            return permits;
        }

        public void setPermits(long permits) {
            this.permits = permits;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }
    }

    /**
     * Status sink selection.
     */
    public static class SinkProperties {

        /**
         * Where item status transitions go.
         */
        private SinkType type = SinkType.LOGGING;

        public SinkType getType() {
            return type;
        }

        public void setType(SinkType type) {
            this.type = type;
        }
    }

    public enum SinkType {
        LOGGING,
        JDBC
    }
}
