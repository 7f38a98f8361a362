package com.ivamare.pipeline.health;

import com.ivamare.pipeline.PipelineAutoConfiguration;
import com.ivamare.pipeline.controller.PipelineController;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for pipeline health indicators.
 */
@AutoConfiguration(after = PipelineAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(PipelineController.class)
@ConditionalOnProperty(prefix = "pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(PipelineHealthIndicator.class)
    public PipelineHealthIndicator pipelineHealthIndicator(PipelineController pipelineController) {
        return new PipelineHealthIndicator(pipelineController);
    }
}
