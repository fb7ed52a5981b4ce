package com.example.guardianservice.metrics;

import com.example.guardianservice.config.AsyncConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.prometheus.PrometheusMetricsExportAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Meter registry wiring for the metrics component and the overhaul executor.
 */
class GuardianMetricsWiringTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    MetricsAutoConfiguration.class,
                    PrometheusMetricsExportAutoConfiguration.class,
                    SimpleMetricsExportAutoConfiguration.class,
                    CompositeMeterRegistryAutoConfiguration.class))
            .withUserConfiguration(GuardianMetrics.class, AsyncConfig.class)
            .withPropertyValues("management.metrics.tags.application=guardian-service");

    @Test
    void testContext_WithActuatorMetrics_ProvidesRegistryToGuardianMetrics() {
        contextRunner.run(context -> {
            // GIVEN: the metrics auto-configuration and the service's metrics beans
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(GuardianMetrics.class);
            assertThat(context).hasSingleBean(PrometheusMeterRegistry.class);

            // WHEN: a run outcome is recorded
            context.getBean(GuardianMetrics.class).recordRun("completed");

            // THEN: the counter is registered with the common application tag
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.get("guardian_overhaul_runs_total")
                    .tag("outcome", "completed")
                    .tag("application", "guardian-service")
                    .counter()
                    .count()).isEqualTo(1.0);
        });
    }

    @Test
    void testContext_WithOverhaulExecutor_RegistersThreadPoolGauges() {
        contextRunner.run(context -> {
            // GIVEN / WHEN: the overhaul executor is created
            assertThat(context).hasBean("overhaulTaskExecutor");

            // THEN: its pool gauges are registered in the shared registry
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.get("thread_pool_active").tag("executor", "overhaul").gauge().value())
                    .isEqualTo(0.0);
            assertThat(registry.get("thread_pool_queue_size").tag("executor", "overhaul").gauge().value())
                    .isEqualTo(0.0);
        });
    }
}
