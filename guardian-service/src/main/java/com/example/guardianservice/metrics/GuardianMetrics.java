package com.example.guardianservice.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - guardian_overhaul_runs_total: overhaul runs by outcome (completed, failed, cancelled, rejected)
 * - guardian_overhaul_step_seconds: step duration by step kind
 * - guardian_remote_retries_total: retried remote platform calls
 * - guardian_level_crossings_total: tier crossings applied by the level engine
 * - guardian_reconciliation_failures_total: tier role add/remove failures (XP kept)
 * - guardian_panel_repairs_total: reaction panels recreated after going missing
 */
@Component
@Slf4j
public class GuardianMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter retryCounter;
    private final Counter levelCrossingCounter;
    private final Counter reconciliationFailureCounter;
    private final Counter panelRepairCounter;

    public GuardianMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.retryCounter = Counter.builder("guardian_remote_retries_total")
                .description("Remote platform calls retried after a transient failure")
                .register(meterRegistry);

        this.levelCrossingCounter = Counter.builder("guardian_level_crossings_total")
                .description("Tier crossings applied to level profiles")
                .register(meterRegistry);

        this.reconciliationFailureCounter = Counter.builder("guardian_reconciliation_failures_total")
                .description("Tier role reconciliations that failed; XP was still recorded")
                .register(meterRegistry);

        this.panelRepairCounter = Counter.builder("guardian_panel_repairs_total")
                .description("Reaction panels recreated because the message or channel was gone")
                .register(meterRegistry);
    }

    /**
     * Record the terminal outcome of one overhaul or repair run.
     */
    public void recordRun(String outcome) {
        Counter.builder("guardian_overhaul_runs_total")
                .description("Overhaul runs by terminal outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        log.debug("Recorded overhaul run: outcome={}", outcome);
    }

    public void recordStep(String kind, Duration duration) {
        Timer.builder("guardian_overhaul_step_seconds")
                .description("Duration of overhaul steps")
                .tag("kind", kind)
                .register(meterRegistry)
                .record(duration);
    }

    public void recordRetry() {
        retryCounter.increment();
    }

    public void recordLevelCrossing() {
        levelCrossingCounter.increment();
    }

    public void recordReconciliationFailure() {
        reconciliationFailureCounter.increment();
    }

    public void recordPanelRepair() {
        panelRepairCounter.increment();
    }

    /**
     * Register thread pool metrics for the overhaul executor.
     */
    public void registerThreadPoolMetrics(String executorName, ThreadPoolExecutor executor) {
        Gauge.builder("thread_pool_active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("executor", executorName)
                .description("Active thread count")
                .register(meterRegistry);

        Gauge.builder("thread_pool_queue_size", executor, e -> e.getQueue().size())
                .tag("executor", executorName)
                .description("Queue size")
                .register(meterRegistry);
    }
}
