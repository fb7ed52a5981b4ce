package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.overhaul.plan.Step;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Terminal state of a run.
 *
 * @param failedStep   the step that aborted the run, {@code null} unless {@link Outcome#FAILED}
 * @param errorMessage the error of the failed step, verbatim
 */
public record RunResult(
        Outcome outcome,
        int completedSteps,
        int totalSteps,
        Step failedStep,
        String errorMessage,
        String summary,
        List<Step> steps
) {
    public RunResult {
        steps = List.copyOf(steps);
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }

    public Optional<Step> getFailedStep() {
        return Optional.ofNullable(failedStep);
    }

    public enum Outcome {
        COMPLETED,
        FAILED,
        CANCELLED;

        public String metricTag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
