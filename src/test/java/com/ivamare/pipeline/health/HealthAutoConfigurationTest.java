package com.ivamare.pipeline.health;

import com.ivamare.pipeline.PipelineAutoConfiguration;
import com.ivamare.pipeline.controller.PipelineController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(PipelineAutoConfiguration.class, HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create health indicator when controller exists")
    void shouldCreateHealthIndicator() {
        contextRunner
            .withUserConfiguration(ControllerConfig.class)
            .run(context -> assertThat(context).hasSingleBean(PipelineHealthIndicator.class));
    }

    @Test
    @DisplayName("should not create health indicator without controller")
    void shouldNotCreateHealthIndicatorWithoutController() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(PipelineHealthIndicator.class));
    }

    @Test
    @DisplayName("should not create health indicator when disabled")
    void shouldNotCreateHealthIndicatorWhenDisabled() {
        contextRunner
            .withUserConfiguration(ControllerConfig.class)
            .withPropertyValues("pipeline.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(PipelineHealthIndicator.class));
    }

    @Test
    @DisplayName("should use custom health indicator if provided")
    void shouldUseCustomHealthIndicator() {
        contextRunner
            .withUserConfiguration(ControllerConfig.class, CustomHealthConfig.class)
            .run(context -> assertThat(context.getBean(PipelineHealthIndicator.class))
                .isSameAs(CustomHealthConfig.CUSTOM));
    }

    @Configuration
    static class ControllerConfig {
        @Bean
        PipelineController pipelineController() {
            return mock(PipelineController.class);
        }
    }

    @Configuration
    static class CustomHealthConfig {
        static final PipelineHealthIndicator CUSTOM = new PipelineHealthIndicator(null);

        @Bean
        PipelineHealthIndicator customHealthIndicator() {
            return CUSTOM;
        }
    }
}
