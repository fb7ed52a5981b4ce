package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.config.OverhaulSettings;
import com.example.guardianservice.metrics.GuardianMetrics;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.progress.ProgressReporter;
import com.example.guardianservice.overhaul.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs planned steps strictly one after another.
 * <p>
 * Transient failures are retried inside the platform client; anything that reaches this class
 * fails the step, skips the rest and ends the run. Cancellation is checked between steps only,
 * so a step is never left half done.
 */
@Component
@Slf4j
public class StepExecutor {

    private final List<StepHandler> handlers;
    private final GuardianMetrics metrics;
    private final Clock clock;
    private final OverhaulSettings settings;

    public StepExecutor(List<StepHandler> handlers, GuardianMetrics metrics, Clock clock, OverhaulSettings settings) {
        this.handlers = List.copyOf(handlers);
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
    }

    public RunResult execute(List<Step> steps, RunContext context, ProgressSink sink) {
        int total = steps.size();
        ProgressReporter reporter = new ProgressReporter(sink, clock, settings, total);
        reporter.started(total == 0 ? "Nothing to do" : steps.get(0).getLabel());

        int completed = 0;
        for (int i = 0; i < total; i++) {
            Step step = steps.get(i);
            if (context.getCancelToken().isCancelled()) {
                skipFrom(steps, i);
                log.info("Overhaul cancelled: guildId={} completed={}/{}", context.getGuildId(), completed, total);
                reporter.cancelled(completed);
                return new RunResult(RunResult.Outcome.CANCELLED, completed, total, null, null, null, steps);
            }

            step.markRunning();
            log.info("Step started: guildId={} step={}/{} kind={} label='{}'",
                    context.getGuildId(), i + 1, total, step.getKind().key(), step.getLabel());
            Instant begin = clock.instant();
            try {
                handlerFor(step).execute(step, context);
            } catch (RuntimeException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                step.markFailed(error);
                metrics.recordStep(step.getKind().key(), Duration.between(begin, clock.instant()));
                skipFrom(steps, i + 1);
                log.error("Step failed, aborting run: guildId={} step={}/{} kind={} error={}",
                        context.getGuildId(), i + 1, total, step.getKind().key(), error, e);
                reporter.failed(i + 1, step.getLabel(), error);
                return new RunResult(RunResult.Outcome.FAILED, completed, total, step, error, null, steps);
            }
            step.markSucceeded();
            completed++;
            metrics.recordStep(step.getKind().key(), Duration.between(begin, clock.instant()));
            if (completed < total) {
                reporter.stepCompleted(completed, steps.get(i + 1).getLabel());
            }
        }

        reporter.completed(context.getSummary());
        log.info("Overhaul completed: guildId={} steps={} created={} reused={}",
                context.getGuildId(), total, context.getCreated(), context.getReused());
        return new RunResult(RunResult.Outcome.COMPLETED, completed, total, null, null, context.getSummary(), steps);
    }

    private StepHandler handlerFor(Step step) {
        return handlers.stream()
                .filter(handler -> handler.supports(step))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No handler for step kind " + step.getKind()));
    }

    private static void skipFrom(List<Step> steps, int from) {
        for (int i = from; i < steps.size(); i++) {
            steps.get(i).markSkipped();
        }
    }
}
